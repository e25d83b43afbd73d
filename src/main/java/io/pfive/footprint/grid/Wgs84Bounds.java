// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.grid;

import org.locationtech.jts.geom.Envelope;

/// Geographic extent of a footprint raster, as written into the georeferencing of every output
/// format. Width and height instead of min/max are somewhat easier to validate as long as all
/// values are positive.
public record Wgs84Bounds(double minLon, double minLat, double widthLon, double heightLat) {

    public double maxLon () { return minLon + widthLon; }
    public double maxLat () { return minLat + heightLat; }

    public static Wgs84Bounds fromWgsEnvelope (Envelope env) {
        return new Wgs84Bounds(env.getMinX(), env.getMinY(), env.getWidth(), env.getHeight());
    }

    /// Return a multiplicative factor for expanding degrees longitude to make them roughly the
    /// same physical length as degrees latitude, evaluated at the given latitude.
    public static double xScale (double lat) {
        return 1 / Math.cos(Math.toRadians(lat));
    }
}
