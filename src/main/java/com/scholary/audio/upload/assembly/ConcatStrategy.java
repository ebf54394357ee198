package com.scholary.audio.upload.assembly;

import com.scholary.audio.upload.objectstore.ObjectStoreClient;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fast path: download every chunk, concatenate in memory, write the target with one put.
 *
 * <p>Memory use grows with the file size, so this strategy is only selected below the fast-path
 * threshold.
 */
@Component
public class ConcatStrategy implements ReconstructionStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConcatStrategy.class);

  public static final String NAME = "concat";

  private final ObjectStoreClient objectStoreClient;

  public ConcatStrategy(ObjectStoreClient objectStoreClient) {
    this.objectStoreClient = objectStoreClient;
  }

  @Override
  public ReconstructionOutcome reconstruct(ReconstructionContext context) {
    List<byte[]> chunks = new ArrayList<>(context.chunkKeys().size());
    long total = 0;

    for (String chunkKey : context.chunkKeys()) {
      context.deadline().checkNotExpired("download of " + chunkKey);
      byte[] chunk = objectStoreClient.getObjectBytes(context.bucket(), chunkKey);
      chunks.add(chunk);
      total += chunk.length;
    }

    byte[] complete = new byte[Math.toIntExact(total)];
    int offset = 0;
    for (byte[] chunk : chunks) {
      System.arraycopy(chunk, 0, complete, offset, chunk.length);
      offset += chunk.length;
    }
    chunks.clear();

    context.deadline().checkNotExpired("upload of " + context.targetKey());
    objectStoreClient.putObject(
        context.bucket(), context.targetKey(), complete, context.contentType());

    LOGGER.debug(
        "Concatenated {} chunks into {}: size={}",
        context.chunkKeys().size(),
        context.targetKey(),
        total);
    return new ReconstructionOutcome(total, 1, total);
  }

  @Override
  public String getStrategyName() {
    return NAME;
  }
}
