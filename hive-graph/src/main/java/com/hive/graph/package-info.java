/**
 * Workflow graph definition: immutable nodes and conditioned edges ({@link com.hive.graph.model}),
 * structural validation ({@link com.hive.graph.validation}), the predicate language used for routing
 * ({@link com.hive.graph.expression}) and loading from cache or local files ({@link com.hive.graph.load}).
 * {@link com.hive.graph.GraphConfig} is the JSON codec.
 */
package com.hive.graph;
