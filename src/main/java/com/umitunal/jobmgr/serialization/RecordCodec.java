package com.umitunal.jobmgr.serialization;

/**
 * Interface for encoding and decoding one persisted record per text line.
 *
 * @param <T> the type of record
 */
public interface RecordCodec<T> {

    /**
     * Encode a record to a single line, without the line terminator.
     */
    String encode(T record);

    /**
     * Decode a line to a record.
     *
     * @throws IllegalArgumentException if the line is not a valid record
     */
    T decode(String line);
}
