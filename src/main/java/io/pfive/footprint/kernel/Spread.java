// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.kernel;

/// Empirical spread of the active particles at one time step: the bootstrap estimate of their mean
/// pairwise distance in degrees, and their mean latitude.
public record Spread (int tenths, double distance, double meanLat) { }
