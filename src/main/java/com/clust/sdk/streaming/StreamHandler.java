package com.clust.sdk.streaming;

import com.clust.sdk.models.MessagesResponseBody;
import com.clust.sdk.models.content.ContentBlock;

/**
 * Handler interface for processing stream chunks.
 *
 * <p>Every callback defaults to doing nothing; override the ones of interest and feed chunks
 * to {@link #handle(StreamChunk)}.</p>
 */
public interface StreamHandler {

    /**
     * Called when a message stream starts.
     *
     * @param message the message, with empty content and no stop reason yet
     */
    default void onMessageStart(MessagesResponseBody message) {}

    /**
     * Called when a content block opens.
     */
    default void onContentBlockStart(int index, ContentBlock contentBlock) {}

    /**
     * Called when text is appended to a content block.
     *
     * @param index the index of the content block
     * @param text the incremental text
     */
    default void onTextDelta(int index, String text) {}

    default void onContentBlockStop(int index) {}

    /**
     * Called when the stop reason and output usage are reported.
     */
    default void onMessageDelta(StreamStop delta, DeltaUsage usage) {}

    /**
     * Called when a message stream ends.
     */
    default void onMessageStop() {}

    default void onPing() {}

    /**
     * Called for every chunk, before the typed callback.
     */
    default void onChunk(StreamChunk chunk) {}

    /**
     * Dispatches a chunk to {@link #onChunk} and then to the callback for its type.
     */
    default void handle(StreamChunk chunk) {
        onChunk(chunk);

        switch (chunk.getType()) {
            case MESSAGE_START:
                onMessageStart(((MessageStartChunk) chunk).getMessage());
                break;
            case CONTENT_BLOCK_START:
                ContentBlockStartChunk start = (ContentBlockStartChunk) chunk;
                onContentBlockStart(start.getIndex(), start.getContentBlock());
                break;
            case CONTENT_BLOCK_DELTA:
                ContentBlockDeltaChunk delta = (ContentBlockDeltaChunk) chunk;
                onTextDelta(delta.getIndex(), delta.getDelta().getText());
                break;
            case CONTENT_BLOCK_STOP:
                onContentBlockStop(((ContentBlockStopChunk) chunk).getIndex());
                break;
            case MESSAGE_DELTA:
                MessageDeltaChunk messageDelta = (MessageDeltaChunk) chunk;
                onMessageDelta(messageDelta.getDelta(), messageDelta.getUsage());
                break;
            case MESSAGE_STOP:
                onMessageStop();
                break;
            case PING:
                onPing();
                break;
        }
    }
}
