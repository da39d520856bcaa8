package com.simnotes.index;

import java.util.concurrent.locks.ReentrantLock;

final class PathLocks {
    private final ReentrantLock[] stripes;

    PathLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            // fair, so operations on one path complete in arrival order
            stripes[i] = new ReentrantLock(true);
        }
    }

    ReentrantLock lockFor(String path) {
        return stripes[Math.floorMod(path.hashCode(), stripes.length)];
    }
}
