package com.cairnsystems.persistence;

/**
 * Base exception for journal-related errors.
 * Provides specific exception types for different failure scenarios.
 */
public class JournalException extends RuntimeException {

    public JournalException(String message) {
        super(message);
    }

    public JournalException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a request arrives while the journal's request buffer is full.
     * The request is answered with a failure immediately and never reaches storage.
     */
    public static class BufferOverflowException extends JournalException {
        private final int maxBufferSize;

        public BufferOverflowException(int maxBufferSize) {
            super(String.format("Journal request buffer is full (max-buffer-size: %d)", maxBufferSize));
            this.maxBufferSize = maxBufferSize;
        }

        public int getMaxBufferSize() {
            return maxBufferSize;
        }
    }

    /**
     * Thrown when a chunk transaction fails to commit or roll back.
     */
    public static class TransactionFailedException extends JournalException {
        public TransactionFailedException(String message) {
            super(message);
        }

        public TransactionFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when a stored row cannot be turned back into a record.
     */
    public static class CorruptedDataException extends JournalException {
        private final long sequenceNumber;

        public CorruptedDataException(String message, long sequenceNumber) {
            super(String.format("%s (sequence: %d)", message, sequenceNumber));
            this.sequenceNumber = sequenceNumber;
        }

        public CorruptedDataException(String message, long sequenceNumber, Throwable cause) {
            super(String.format("%s (sequence: %d)", message, sequenceNumber), cause);
            this.sequenceNumber = sequenceNumber;
        }

        public long getSequenceNumber() {
            return sequenceNumber;
        }
    }

    /**
     * Thrown when the backing store cannot be reached or rejects schema setup.
     */
    public static class StorageException extends JournalException {
        public StorageException(String message) {
            super(message);
        }

        public StorageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
