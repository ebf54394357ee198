package com.scholary.audio.upload.catalog;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * In-memory catalog using Caffeine.
 *
 * <p>Stands in for the catalog database, which lives outside this service. Entries are evicted by
 * size and age so memory stays bounded.
 */
@Component
public class InMemoryAssetRecorder implements AssetRecorder {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAssetRecorder.class);

  private final Cache<String, AssetRecord> assets;
  private final Cache<String, ParentRecordUpdate> parents;

  public InMemoryAssetRecorder(
      @Value("${catalog.maxSize:10000}") int maxSize,
      @Value("${catalog.expireAfter:24h}") Duration expireAfter) {
    this.assets = Caffeine.newBuilder().maximumSize(maxSize).expireAfterWrite(expireAfter).build();
    this.parents = Caffeine.newBuilder().maximumSize(maxSize).expireAfterWrite(expireAfter).build();
    LOGGER.info("Initialized in-memory catalog: maxSize={}, expireAfter={}", maxSize, expireAfter);
  }

  @Override
  public void recordAsset(AssetRecord record) {
    if (record.ownerId() == null || record.finalKey() == null) {
      throw new CatalogException("Asset record requires owner id and final key");
    }
    assets.put(record.finalKey(), record);
    LOGGER.info("Recorded asset: owner={}, key={}", record.ownerId(), record.finalKey());
  }

  @Override
  public void updateParentRecord(ParentRecordUpdate update) {
    if (update.ownerId() == null) {
      throw new CatalogException("Parent record update requires owner id");
    }
    parents.put(update.ownerId(), update);
    LOGGER.info("Updated parent record: owner={}, url={}", update.ownerId(), update.publicUrl());
  }

  public Optional<AssetRecord> findByKey(String finalKey) {
    return Optional.ofNullable(assets.getIfPresent(finalKey));
  }

  public List<AssetRecord> findByOwner(String ownerId) {
    return assets.asMap().values().stream()
        .filter(record -> record.ownerId().equals(ownerId))
        .sorted(Comparator.comparingInt(AssetRecord::sortOrder))
        .toList();
  }

  public Optional<ParentRecordUpdate> findParent(String ownerId) {
    return Optional.ofNullable(parents.getIfPresent(ownerId));
  }
}
