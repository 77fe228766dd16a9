/**
 * Pure Java value types shared across all peprobe modules.
 *
 * <p>Digest algorithm identifiers and the PE/COFF container constants that the
 * image parser compares against. {@code ContentDigest} and the buffer types live
 * in {@code shared/utils}. No framework dependencies.
 */
package com.libragraph.peprobe.types;
