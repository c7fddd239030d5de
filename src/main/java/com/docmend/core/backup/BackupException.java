package com.docmend.core.backup;

/**
 * Thrown when a file cannot be copied to the backup directory. A file whose
 * backup failed must not be written.
 */
public class BackupException extends RuntimeException {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
