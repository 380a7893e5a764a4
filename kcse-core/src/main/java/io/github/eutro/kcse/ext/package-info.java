/**
 * Typed metadata for IR objects.
 *
 * <pre>{@code
 * public static final Ext<Integer> DEPTH = Ext.create(Integer.class, "DEPTH");
 *
 * stmt.attachExt(DEPTH, 2);
 * stmt.getExtOrThrow(DEPTH); // => 2
 * }</pre>
 * <p>
 * Passes use exts for scratch data and for properties that are looked up through a chain
 * of containers, such as purity, which is usually declared once on an
 * {@link io.github.eutro.kcse.ops.OpKey} but can be overridden on a single statement.
 */
package io.github.eutro.kcse.ext;
