package com.docmend.core.model;

/**
 * Listing entry for a backup file on disk.
 *
 * @param name    file name inside the backup directory
 * @param size    size in bytes
 * @param created ISO-8601 last-modified time
 * @param path    full path of the backup file
 */
public record BackupInfo(
    String name,
    long size,
    String created,
    String path
) {}
