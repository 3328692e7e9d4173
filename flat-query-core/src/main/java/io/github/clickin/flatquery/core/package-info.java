/**
 * Codec between flat {@code key=value&key=value} text and structured values.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.github.clickin.flatquery.core.FlatQuery} (entry point and configuration)</li>
 *   <li>{@link io.github.clickin.flatquery.core.Shape} and its built-in implementations, which
 *       drive encoding and decoding without reflection</li>
 *   <li>{@link io.github.clickin.flatquery.core.FieldMap} (decoder input model)</li>
 *   <li>{@link io.github.clickin.flatquery.core.FlatQueryException} (every failure)</li>
 * </ul>
 *
 * <p>No percent-encoding or decoding is performed here; that belongs to the HTTP adapter.
 */
package io.github.clickin.flatquery.core;
