package com.scholary.audio.upload.assembly;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

/**
 * Picks the reconstruction strategy from the estimated object size.
 *
 * <p>The estimate is the declared size when the caller gave one, otherwise the chunk count times
 * the nominal chunk size. A wrong estimate only costs efficiency: both strategies produce the same
 * object.
 */
@Component
public class StrategySelector {

  private final ReconstructionStrategy fastPath;
  private final ReconstructionStrategy largeFilePath;
  private final long threshold;
  private final long nominalChunkSize;

  public StrategySelector(
      ConcatStrategy fastPath,
      MultipartStrategy largeFilePath,
      @Value("${upload.fastPathThreshold:10MB}") DataSize threshold,
      @Value("${upload.nominalChunkSize:3584KB}") DataSize nominalChunkSize) {
    this.fastPath = fastPath;
    this.largeFilePath = largeFilePath;
    this.threshold = threshold.toBytes();
    this.nominalChunkSize = nominalChunkSize.toBytes();
  }

  public long estimateSize(Long declaredSize, int chunkCount) {
    if (declaredSize != null && declaredSize > 0) {
      return declaredSize;
    }
    return chunkCount * nominalChunkSize;
  }

  public ReconstructionStrategy select(long estimatedSize) {
    return estimatedSize < threshold ? fastPath : largeFilePath;
  }
}
