/**
 * Shared utilities for all peprobe modules.
 *
 * <p>Contains {@link com.libragraph.peprobe.util.ContentDigest} (algorithm-tagged digest value)
 * and the {@link com.libragraph.peprobe.util.buffer buffer layer} ({@code ByteView}).
 * No framework dependencies, pure Java.
 */
package com.libragraph.peprobe.util;
