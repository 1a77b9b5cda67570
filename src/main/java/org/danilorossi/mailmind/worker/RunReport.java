package org.danilorossi.mailmind.worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.Value;
import lombok.val;

/** Stato finale dell'esecuzione, per account. */
@Value
public class RunReport {

  public enum Status {
    ALL_RUNNING,
    SOME_FAILED,
    ALL_FAILED
  }

  Status status;

  /** account -> motivo dell'arresto definitivo. */
  Map<String, String> failures;

  /** account -> contatori del worker. */
  Map<String, String> summaries;

  /** Diverso da zero solo se nessun account è riuscito a partire. */
  public int exitCode() {
    return status == Status.ALL_FAILED ? 1 : 0;
  }

  public static RunReport of(@NonNull final List<AccountWorker> workers) {
    val failures = new LinkedHashMap<String, String>();
    val summaries = new LinkedHashMap<String, String>();
    int neverStarted = 0;
    for (val w : workers) {
      val name = w.getAccount().getName();
      summaries.put(name, w.summary());
      if (w.getFatalReason() != null) failures.put(name, w.getFatalReason());
      if (w.getFatalReason() != null && !w.isEverConnected()) neverStarted++;
    }

    final Status status;
    if (!workers.isEmpty() && neverStarted == workers.size()) status = Status.ALL_FAILED;
    else if (!failures.isEmpty()) status = Status.SOME_FAILED;
    else status = Status.ALL_RUNNING;
    return new RunReport(
        status, Collections.unmodifiableMap(failures), Collections.unmodifiableMap(summaries));
  }

  public String describe() {
    val sb = new StringBuilder();
    switch (status) {
      case ALL_RUNNING -> sb.append("Nessun account fermato da errori definitivi.");
      case SOME_FAILED -> sb.append("Alcuni account si sono fermati per errore:");
      case ALL_FAILED -> sb.append("Nessun account è riuscito a partire:");
    }
    failures.forEach((k, v) -> sb.append("\n  - ").append(k).append(": ").append(v));
    summaries.forEach((k, v) -> sb.append("\n  [").append(k).append("] ").append(v));
    return sb.toString();
  }
}
