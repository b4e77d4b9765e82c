package com.areakeeper.service.validator;

import org.locationtech.jts.geom.Coordinate;

/**
 * Albers equal-area conic projection on the WGS84 ellipsoid (Snyder, "Map Projections: A Working
 * Manual", eq. 14-1 to 14-12). Standard parallels are chosen by the caller, usually the latitude
 * bounds of the geometry being measured.
 *
 * When the cone constant is close to zero (parallels nearly symmetric about the equator) the
 * projection degenerates to the Lambert cylindrical equal-area projection, which is used instead.
 */
final class AlbersEqualArea {

    static final double SEMI_MAJOR_AXIS = 6_378_137.0;
    static final double FLATTENING = 1 / 298.257223563;

    private static final double E2 = FLATTENING * (2 - FLATTENING);
    private static final double E = Math.sqrt(E2);
    // Below this the cone apex is so far away that rho loses the latitude signal to rounding.
    private static final double CYLINDRICAL_THRESHOLD = 1e-4;

    private final double n;
    private final double c;
    private final double centralMeridian;

    AlbersEqualArea(double standardParallel1, double standardParallel2, double centralMeridian) {
        double phi1 = Math.toRadians(standardParallel1);
        double phi2 = Math.toRadians(standardParallel2);
        double m1 = m(phi1);
        if (Math.abs(phi1 - phi2) < 1e-12) {
            this.n = Math.sin(phi1);
        } else {
            double m2 = m(phi2);
            this.n = (m1 * m1 - m2 * m2) / (q(phi2) - q(phi1));
        }
        this.c = m1 * m1 + n * q(phi1);
        this.centralMeridian = Math.toRadians(centralMeridian);
    }

    Coordinate project(double longitude, double latitude) {
        double lambda = Math.toRadians(longitude) - centralMeridian;
        double phi = Math.toRadians(latitude);
        if (Math.abs(n) < CYLINDRICAL_THRESHOLD) {
            return new Coordinate(SEMI_MAJOR_AXIS * lambda, SEMI_MAJOR_AXIS * q(phi) / 2);
        }
        double rho = SEMI_MAJOR_AXIS * Math.sqrt(Math.max(0, c - n * q(phi))) / n;
        double theta = n * lambda;
        return new Coordinate(rho * Math.sin(theta), -rho * Math.cos(theta));
    }

    private static double q(double phi) {
        double sin = Math.sin(phi);
        return (1 - E2) * (sin / (1 - E2 * sin * sin)
            - (1 / (2 * E)) * Math.log((1 - E * sin) / (1 + E * sin)));
    }

    private static double m(double phi) {
        double sin = Math.sin(phi);
        return Math.cos(phi) / Math.sqrt(1 - E2 * sin * sin);
    }
}
