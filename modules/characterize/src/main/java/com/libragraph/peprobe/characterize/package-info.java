/**
 * Content-characterization primitives for executable-file analysis.
 *
 * <p>Each component is a stateless {@code @ApplicationScoped} bean that also works
 * without a container:
 * <ul>
 *   <li>{@link com.libragraph.peprobe.characterize.entropy.EntropyMeter}: Shannon entropy</li>
 *   <li>{@link com.libragraph.peprobe.characterize.digest.DigestComputer}: MD5/SHA-1/SHA-256</li>
 *   <li>{@link com.libragraph.peprobe.characterize.fuzzy.FuzzyFingerprintAdapter}: similarity fingerprint</li>
 *   <li>{@link com.libragraph.peprobe.characterize.names.NameValidator}: import/DLL name heuristics</li>
 * </ul>
 * {@link com.libragraph.peprobe.characterize.profile.ContentProfiler} runs all of them over one range.
 */
package com.libragraph.peprobe.characterize;
