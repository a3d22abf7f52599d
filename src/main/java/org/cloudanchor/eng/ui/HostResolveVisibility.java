package org.cloudanchor.eng.ui;

public enum HostResolveVisibility {
    ALL, ONLY_HOST, ONLY_RESOLVE
}
