package com.scholary.livefeed.detection;

import com.scholary.livefeed.chunking.ChunkDescriptor;

/**
 * Interface for the downstream detection pipeline.
 *
 * <p>Delivery is at-least-once: the same chunk may be submitted again after a failure, and
 * implementations must tolerate that.
 */
public interface DetectionService {

  /**
   * Process one chunk. A single attempt; retries belong to the caller.
   *
   * @param chunk a READY chunk
   * @return the detection result
   * @throws DetectionException if the chunk could not be processed
   */
  DetectionResult process(ChunkDescriptor chunk);
}
