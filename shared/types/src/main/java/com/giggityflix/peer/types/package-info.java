/**
 * Pure Java value types shared across all peer modules.
 *
 * <p>No framework dependencies.
 */
package com.giggityflix.peer.types;
