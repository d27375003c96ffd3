package com.scholary.meditation.store;

import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import java.util.List;
import java.util.Optional;

/**
 * Append-only snapshot persistence for pipeline state.
 *
 * <p>Every save creates a new snapshot; nothing is overwritten or compacted, so every intermediate
 * state of a run stays inspectable.
 */
public interface StateStore {

  /**
   * Persist a snapshot of the state tagged with the step that produced it.
   *
   * @return the id of the new snapshot
   * @throws StateStoreException if the snapshot cannot be written
   */
  String save(PipelineState state, PipelineStep step);

  /**
   * Load a snapshot.
   *
   * @throws SnapshotNotFoundException if no snapshot has this id
   * @throws StateStoreException if the snapshot exists but cannot be read or parsed
   */
  PipelineState load(String snapshotId);

  /** The most recent snapshot written for the given step. */
  Optional<String> latest(PipelineStep step);

  /**
   * The most recent snapshot of the most advanced step that has one. A later re-run of an earlier
   * step does not move this backwards.
   */
  Optional<String> latest();

  /** All snapshot ids in write order. */
  List<String> list();
}
