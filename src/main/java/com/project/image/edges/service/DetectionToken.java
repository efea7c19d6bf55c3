package com.project.image.edges.service;

/** Lets a running detection find out that a newer one replaced it. */
public interface DetectionToken {

    DetectionToken NONE = new DetectionToken() {
        @Override
        public long generation() {
            return 0L;
        }

        @Override
        public boolean isSuperseded() {
            return false;
        }
    };

    long generation();

    boolean isSuperseded();
}
