package com.cairnsystems.config;

/**
 * Configuration for actor mailbox settings.
 */
public class MailboxConfig {
    public static final int DEFAULT_INITIAL_CAPACITY = 64;
    public static final int DEFAULT_MAX_CAPACITY = Integer.MAX_VALUE;

    private int initialCapacity;
    private int maxCapacity;
    private MailboxType mailboxType;

    /**
     * The queue implementation backing a mailbox.
     */
    public enum MailboxType {
        /** LinkedBlockingQueue; bounded when a max capacity is set. */
        LINKED,
        /** JCTools multi-producer single-consumer queue; always unbounded. */
        MPSC
    }

    /**
     * Creates a new MailboxConfig with default values.
     */
    public MailboxConfig() {
        this.initialCapacity = DEFAULT_INITIAL_CAPACITY;
        this.maxCapacity = DEFAULT_MAX_CAPACITY;
        this.mailboxType = MailboxType.LINKED;
    }

    /**
     * Sets the initial capacity for the mailbox.
     *
     * @param initialCapacity The initial capacity
     * @return This MailboxConfig instance
     */
    public MailboxConfig setInitialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
        return this;
    }

    /**
     * Sets the maximum capacity for the mailbox. Ignored by {@link MailboxType#MPSC}.
     *
     * @param maxCapacity The maximum capacity
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMaxCapacity(int maxCapacity) {
        this.maxCapacity = maxCapacity;
        return this;
    }

    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = mailboxType;
        return this;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    /**
     * @return true if the mailbox has no upper bound
     */
    public boolean isUnbounded() {
        return mailboxType == MailboxType.MPSC || maxCapacity == Integer.MAX_VALUE;
    }

    @Override
    public String toString() {
        return "MailboxConfig{type=" + mailboxType + ", initialCapacity=" + initialCapacity
                + ", maxCapacity=" + maxCapacity + "}";
    }
}
