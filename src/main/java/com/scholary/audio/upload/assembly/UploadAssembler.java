package com.scholary.audio.upload.assembly;

import com.scholary.audio.upload.logging.StructuredLogger;
import com.scholary.audio.upload.objectstore.ObjectStoreClient;
import com.scholary.audio.upload.objectstore.ObjectStoreException;
import com.scholary.audio.upload.session.ChunkKeys;
import com.scholary.audio.upload.session.SessionLeaseRegistry;
import com.scholary.audio.upload.session.UploadSession;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Turns the chunks of one upload session into a single durable object.
 *
 * <p>Steps, all under a per-session lease and a deadline:
 *
 * <ol>
 *   <li>List the session's chunk objects and check completeness.
 *   <li>Estimate the total size and let the {@link StrategySelector} pick a strategy.
 *   <li>Run the strategy, then sweep whatever chunks remain.
 *   <li>Record the asset through the {@link AssetCataloger}. A catalog failure never undoes the
 *       object.
 * </ol>
 *
 * <p>Completeness failures write nothing to the target key. Storage failures are reported as
 * {@link StorageFailureException} once the strategy has rolled back. A failed sweep is reported
 * in {@link AssemblyResult#chunkCleanup()} on success and attached as a suppressed exception on
 * failure.
 */
@Service
public class UploadAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadAssembler.class);

  private final ObjectStoreClient objectStoreClient;
  private final String bucket;
  private final ChunkKeys chunkKeys;
  private final StrategySelector strategySelector;
  private final ChunkCleaner chunkCleaner;
  private final SessionLeaseRegistry leaseRegistry;
  private final AssetCataloger assetCataloger;
  private final Duration assemblyTimeout;
  private final Clock clock;
  private final StructuredLogger structuredLogger;

  public UploadAssembler(
      ObjectStoreClient objectStoreClient,
      @Value("${objectstore.bucket}") String bucket,
      ChunkKeys chunkKeys,
      StrategySelector strategySelector,
      ChunkCleaner chunkCleaner,
      SessionLeaseRegistry leaseRegistry,
      AssetCataloger assetCataloger,
      @Value("${upload.assemblyTimeout:5m}") Duration assemblyTimeout,
      Clock clock) {
    this.objectStoreClient = objectStoreClient;
    this.bucket = bucket;
    this.chunkKeys = chunkKeys;
    this.strategySelector = strategySelector;
    this.chunkCleaner = chunkCleaner;
    this.leaseRegistry = leaseRegistry;
    this.assetCataloger = assetCataloger;
    this.assemblyTimeout = assemblyTimeout;
    this.clock = clock;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Assemble a session.
   *
   * @param request session plus catalog details
   * @return the assembled object and whether the catalog write succeeded
   * @throws AssemblyInProgressException if the session is already being assembled
   * @throws NoChunksFoundException if the session has no chunks
   * @throws PartCountMismatchException if the chunk count differs from the expected count
   * @throws StorageFailureException if a store call fails
   * @throws AssemblyTimeoutException if the deadline passes
   */
  public AssemblyResult assemble(AssemblyRequest request) {
    String sessionId = request.session().sessionId();
    SessionLeaseRegistry.Lease lease =
        leaseRegistry
            .tryAcquire(sessionId)
            .orElseThrow(() -> new AssemblyInProgressException(sessionId));

    try (lease) {
      return assembleUnderLease(request);
    } catch (AssemblyException e) {
      structuredLogger.logAssemblyFailed(sessionId, e.getErrorCode(), e.getMessage());
      throw e;
    }
  }

  private AssemblyResult assembleUnderLease(AssemblyRequest request) {
    UploadSession session = request.session();
    String sessionId = session.sessionId();
    String prefix = chunkKeys.sessionPrefix(sessionId);
    long startedAt = clock.millis();
    Deadline deadline = Deadline.after(sessionId, assemblyTimeout, clock);

    List<String> keys = listChunks(sessionId, prefix);

    if (keys.isEmpty()) {
      throw new NoChunksFoundException(sessionId);
    }
    if (session.expectedParts() != null && keys.size() != session.expectedParts()) {
      // The client has to restart; leftovers would poison a restart under the same session id
      PartCountMismatchException mismatch =
          new PartCountMismatchException(sessionId, session.expectedParts(), keys.size());
      chunkCleaner.sweep(bucket, prefix).failure().ifPresent(mismatch::addSuppressed);
      throw mismatch;
    }

    long estimatedSize = strategySelector.estimateSize(session.declaredSize(), keys.size());
    ReconstructionStrategy strategy = strategySelector.select(estimatedSize);
    structuredLogger.logAssemblyStarted(
        sessionId, keys.size(), estimatedSize, strategy.getStrategyName());

    ReconstructionContext context =
        new ReconstructionContext(
            sessionId, bucket, session.targetKey(), session.contentType(), keys, deadline);

    ReconstructionOutcome outcome = reconstruct(strategy, context, prefix);

    CleanupResult cleanup = chunkCleaner.sweep(bucket, prefix);

    AssembledObject object =
        new AssembledObject(
            session.targetKey(),
            outcome.byteSize(),
            session.contentType(),
            AudioCodec.detect(
                session.contentType(), AudioCodec.extensionOf(session.targetKey())));

    structuredLogger.logAssemblyCompleted(
        sessionId,
        object.finalKey(),
        object.byteSize(),
        strategy.getStrategyName(),
        clock.millis() - startedAt);

    String publicUrl = FinalKeys.publicUrl(object.finalKey());
    boolean recorded =
        assetCataloger.record(
            request.ownerId(), request.originalName(), request.sortOrder(), object, publicUrl);
    return new AssemblyResult(object, publicUrl, recorded, cleanup);
  }

  private List<String> listChunks(String sessionId, String prefix) {
    List<String> listed;
    try {
      listed = objectStoreClient.listKeys(bucket, prefix);
    } catch (ObjectStoreException e) {
      throw new StorageFailureException(
          sessionId, "Failed to list chunks for session " + sessionId, e, true);
    }

    List<String> keys = new ArrayList<>(listed.size());
    for (String key : listed) {
      try {
        ChunkKeys.partNumberOf(key);
        keys.add(key);
      } catch (IllegalArgumentException e) {
        LOGGER.warn("Ignoring foreign object under session prefix: key={}", key);
      }
    }
    // Zero-padded part numbers make key order equal part order
    keys.sort(Comparator.naturalOrder());
    return keys;
  }

  private ReconstructionOutcome reconstruct(
      ReconstructionStrategy strategy, ReconstructionContext context, String prefix) {
    String sessionId = context.sessionId();
    boolean chunksConsumed = strategy.consumesChunks();
    try {
      return strategy.reconstruct(context);

    } catch (ObjectStoreException e) {
      throw sweepAfterFailure(
          chunksConsumed,
          prefix,
          new StorageFailureException(
              sessionId,
              "Storage failure while assembling session " + sessionId + ": " + e.getMessage(),
              e,
              !chunksConsumed));

    } catch (AssemblyTimeoutException e) {
      throw sweepAfterFailure(chunksConsumed, prefix, chunksConsumed ? e.restartRequired() : e);

    } catch (RuntimeException e) {
      throw sweepAfterFailure(chunksConsumed, prefix, e);
    }
  }

  private RuntimeException sweepAfterFailure(
      boolean chunksConsumed, String prefix, RuntimeException failure) {
    // Untouched chunks stay so the caller can retry the assembly call
    if (chunksConsumed) {
      chunkCleaner.sweep(bucket, prefix).failure().ifPresent(failure::addSuppressed);
    }
    return failure;
  }
}
