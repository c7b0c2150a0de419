package com.themeboard.kr.query;

/**
 * The requested day directory or theme rank does not exist.
 */
public class SnapshotNotFoundException extends RuntimeException {
    public SnapshotNotFoundException(String message) {
        super(message);
    }
}
