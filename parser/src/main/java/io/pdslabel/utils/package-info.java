/**
 * Byte access and ASCII helpers.
 *
 * <p>
 * {@link io.pdslabel.utils.ByteSource} gives the parser random access to a byte array, a buffer or
 * a memory-mapped file without copying it.
 * </p>
 */
package io.pdslabel.utils;
