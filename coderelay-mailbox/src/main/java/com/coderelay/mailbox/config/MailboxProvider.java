package com.coderelay.mailbox.config;

import com.coderelay.mailbox.Mailbox;

/**
 * Creates mailboxes from configuration.
 *
 * @param <M> The type of requests the mailbox will hold
 */
public interface MailboxProvider<M> {

    /**
     * Creates a mailbox for the given configuration.
     *
     * @param config the mailbox configuration, or null for defaults
     * @return a new, empty mailbox
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
