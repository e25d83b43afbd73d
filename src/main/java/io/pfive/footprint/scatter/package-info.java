// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// This package spreads particle influence over the grid. Particles are first collapsed into the
/// distinct cells they occupy at each time, then each occupied cell is smeared with the Gaussian
/// kernel for its time step into accumulators that are padded to hold the widest kernel.
package io.pfive.footprint.scatter;
