// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

///  This package contains classes for tracking progress of long-running footprint computations,
///  which may take minutes on fine grids with long trajectories.
package io.pfive.footprint.background;
