/**
 * Relay Codecs
 * =============================================================================
 *
 * <p>Byte-level encodings used by the relay:</p>
 * <ul>
 *   <li>{@link com.questrail.relay.codec.TransferInstructionCodec}: the data
 *       a message carries, telling the destination relay whom to pay, in
 *       which asset and how much, plus the caller's memo</li>
 *   <li>{@link com.questrail.relay.codec.EnvelopeEncoder} /
 *       {@link com.questrail.relay.codec.EnvelopeDecoder}: a whole delivered
 *       message as one CRC-protected datagram, used by the datagram
 *       transport</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   OutboundDispatcher
 *        → TransferInstructionCodec.encode   (message data)
 *        → RelayTransport.dispatch
 *            → EnvelopeEncoder              (datagram transport only)
 *                → byte[] datagram
 *
 *   byte[] datagram
 *        → EnvelopeDecoder                  (CRC and structure validated here)
 *            → DeliveredMessage
 *                → InboundReceiver
 *                    → TransferInstructionCodec.decode
 * </pre>
 *
 * <p>Decoders never return partial results. Envelope failures are transport
 * defects and cause the datagram to be dropped; instruction failures are
 * reported by the receiving relay as {@code INVALID_PAYLOAD}.</p>
 */
package com.questrail.relay.codec;
