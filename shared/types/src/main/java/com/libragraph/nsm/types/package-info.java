/**
 * Pure Java value types shared across all NSM modules.
 *
 * <p>Algorithm tags recorded in the archive header live here so that the
 * format codec, the engine and the HTTP layer agree on one numbering.
 * This module has no dependencies.
 */
package com.libragraph.nsm.types;
