/**
 * Exts attach typed scratch or derived data to IR objects without widening their classes.
 *
 * <pre>{@code
 * Ext<DominatorTree> DOM_TREE = Ext.create(DominatorTree.class, "DOM_TREE");
 *
 * func.attachExt(DOM_TREE, tree);
 * func.getExtOrThrow(DOM_TREE); // => tree
 * }</pre>
 * <p>
 * Passes use them both for results other passes consume, like
 * {@link io.github.eutro.relift.core.ext.CommonExts#DOM_TREE}, and for private data
 * created with a local {@link io.github.eutro.relift.core.ext.Ext} and removed before the pass returns.
 * {@link io.github.eutro.relift.core.ext.MetadataState} records which of the shared results are current.
 */
package io.github.eutro.relift.core.ext;
