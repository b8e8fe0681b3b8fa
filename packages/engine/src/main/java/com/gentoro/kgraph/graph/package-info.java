/**
 * In-memory graph views of a collection.
 *
 * <p>{@link com.gentoro.kgraph.graph.GraphMaterializer} turns the node and edge records of a
 * {@link com.gentoro.kgraph.store.RecordStore} into an immutable {@link
 * com.gentoro.kgraph.graph.Graph} with sorted adjacency lists. Readers and writers coordinate
 * through {@link com.gentoro.kgraph.graph.CollectionLocks}: graphs are materialized and cached
 * under the read lock and invalidated under the write lock, so no reader observes a half-applied
 * mutation.
 */
package com.gentoro.kgraph.graph;
