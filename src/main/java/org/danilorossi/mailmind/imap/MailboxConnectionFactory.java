package org.danilorossi.mailmind.imap;

import org.danilorossi.mailmind.model.Account;

@FunctionalInterface
public interface MailboxConnectionFactory {

  MailboxConnection create(Account account);
}
