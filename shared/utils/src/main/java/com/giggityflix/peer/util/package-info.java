/**
 * Shared utilities for all peer modules.
 *
 * <p>Contains {@link com.giggityflix.peer.util.DevicePaths}, the path
 * normalization rules used to map filesystem paths onto storage devices.
 * No framework dependencies.
 */
package com.giggityflix.peer.util;
