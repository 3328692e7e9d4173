/**
 * JSON sub-codec SPI.
 *
 * <p>flat-query encodes array fields as a single key holding a JSON array. This module keeps the
 * core independent of any specific JSON library; bindings live in separate modules.
 */
package io.github.clickin.flatquery.json.spi;
