// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Backward particle trajectories as produced by a Lagrangian transport model, and their
/// preparation for kernel density estimation: resampling onto a common set of times and
/// rescaling so the total influence is not changed.
package io.pfive.footprint.trajectory;
