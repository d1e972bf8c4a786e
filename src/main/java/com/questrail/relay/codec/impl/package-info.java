/**
 * Relay Codecs (Binary Implementation)
 * =============================================================================
 *
 * <p>All multi-byte integers are big-endian. Strings are UTF-8 and prefixed
 * with an unsigned 16-bit length; opaque byte blocks are prefixed with a
 * 32-bit length.</p>
 *
 * <h2>Transfer instruction</h2>
 * <pre>
 *   version(1) | recipient(str) | asset(str) | amount(i64) | [memo(blk)]
 * </pre>
 * <p>Version 1 carries no memo; version 2 always carries one, possibly empty.</p>
 *
 * <h2>Envelope</h2>
 * <pre>
 *   'R' 'L' | version(1) | id(str) | source(i64) | destination(i64)
 *   | sender(str) | receiver(str) | data(blk)
 *   | transferCount(u16) | { asset(str) | amount(i64) } * transferCount
 *   | crc(2)
 * </pre>
 * <p>The CRC is CRC-16/ARC over every preceding byte.</p>
 */
package com.questrail.relay.codec.impl;
