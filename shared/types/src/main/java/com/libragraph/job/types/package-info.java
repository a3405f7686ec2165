/**
 * Pure Java value types shared across all job modules.
 *
 * <p>This module has no framework dependencies.
 */
package com.libragraph.job.types;
