package org.tanzu.pvemcp.inventory;

final class Usage {

    private Usage() {
    }

    static Double percent(long used, long capacity) {
        return capacity > 0 ? used * 100.0 / capacity : null;
    }
}
