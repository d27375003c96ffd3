package com.scholary.meditation.store;

/** Thrown when a snapshot id does not name a stored snapshot. */
public class SnapshotNotFoundException extends StateStoreException {

  private final String snapshotId;

  public SnapshotNotFoundException(String snapshotId) {
    super("Snapshot not found: " + snapshotId);
    this.snapshotId = snapshotId;
  }

  public String getSnapshotId() {
    return snapshotId;
  }
}
