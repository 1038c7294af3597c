package com.example.chatpipeline.dispatch;

/**
 * Per (consumer, partition) feed positions. Position 0 means nothing consumed yet.
 */
public interface CursorStore {

    long position(String consumer, String partition);

    void commit(String consumer, String partition, long position);
}
