package org.danilorossi.mailmind.worker;

import java.time.Instant;
import java.util.List;
import org.danilorossi.mailmind.db.FingerprintStore;
import org.danilorossi.mailmind.model.ProcessedRecord;

/** Delega tutto a un altro archivio; i test ridefiniscono i metodi da far fallire. */
class ForwardingStore implements FingerprintStore {

  private final FingerprintStore delegate;

  ForwardingStore(final FingerprintStore delegate) {
    this.delegate = delegate;
  }

  @Override
  public boolean has(String fingerprint) {
    return delegate.has(fingerprint);
  }

  @Override
  public boolean record(String fingerprint, String account, Instant processedAt) {
    return delegate.record(fingerprint, account, processedAt);
  }

  @Override
  public int prune(int maxAgeDays, String accountFilter) {
    return delegate.prune(maxAgeDays, accountFilter);
  }

  @Override
  public int reset(String accountFilter) {
    return delegate.reset(accountFilter);
  }

  @Override
  public Iterable<ProcessedRecord> list(String accountFilter) {
    return delegate.list(accountFilter);
  }

  @Override
  public int count(String accountFilter) {
    return delegate.count(accountFilter);
  }

  @Override
  public List<String> accounts() {
    return delegate.accounts();
  }

  @Override
  public void close() {
    delegate.close();
  }
}
