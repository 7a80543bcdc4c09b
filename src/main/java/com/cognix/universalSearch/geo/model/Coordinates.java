package com.cognix.universalSearch.geo.model;

/**
 * A position on the globe in decimal degrees.
 */
public interface Coordinates {

    double lat();

    double lon();
}
