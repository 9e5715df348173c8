/**
 * Mixed-radix encoding of pre-condition state vectors.
 *
 * <p>{@link com.ryuqq.transmap.core.codec.IndexCodec} maps a state-index vector
 * (outermost dimension first) to its position in the generation order and back.
 * The generation order is the lexicographic order of the Cartesian product of all
 * pre-condition states, the NA sentinel slot included.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * IndexCodec codec = new IndexCodec(3, 2, 4);
 * codec.weights();          // [8, 4, 1]
 * codec.encode(2, 1, 3);    // 23
 * codec.decode(23);         // [2, 1, 3]
 * codec.encode(3, 0, 0);    // StateIndexOutOfRangeException
 * </pre>
 *
 * @since 1.0.0
 * @author Transmap Team
 */
package com.ryuqq.transmap.core.codec;
