package org.cloudanchor.eng.ui;

/**
 * Implemented by the host application. Implementations are responsible for moving the work to their UI thread.
 */
public interface CloudAnchorUi {

    void displayMessageOnLowerSnackbar(String message);

    void setHostAndResolveButtonVisibility(HostResolveVisibility visibility);

    void setRoomCodeText(String text);

    void showResolveDialog();
}
