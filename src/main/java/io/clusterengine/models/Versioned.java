package io.clusterengine.models;

/**
 * An entity updated with compare-and-swap against the store revision it was read at.
 */
public interface Versioned {

    long getRevision();

    void setRevision(long revision);
}
