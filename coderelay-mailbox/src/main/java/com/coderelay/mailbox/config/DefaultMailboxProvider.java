package com.coderelay.mailbox.config;

import com.coderelay.mailbox.Mailbox;
import com.coderelay.mailbox.MpscMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default mailbox provider: a bounded {@link MpscMailbox} of the configured capacity.
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();
        logger.debug("Creating mailbox from {}", effectiveConfig);
        return new MpscMailbox<>(effectiveConfig.getCapacity());
    }
}
