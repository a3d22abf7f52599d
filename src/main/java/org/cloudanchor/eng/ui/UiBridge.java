package org.cloudanchor.eng.ui;

import org.tinylog.Logger;

import java.util.function.Consumer;

/**
 * Fire-and-forget entry point from the render loop to the host UI. Calls made while no UI is registered are dropped,
 * and a failing UI never reaches the caller.
 */
public class UiBridge {

    private static volatile CloudAnchorUi ui;

    private UiBridge() {
        // Utility class
    }

    public static void clearUi() {
        ui = null;
    }

    public static void displayMessageOnLowerSnackbar(String message) {
        dispatch("displayMessageOnLowerSnackbar", u -> u.displayMessageOnLowerSnackbar(message));
    }

    private static void dispatch(String call, Consumer<CloudAnchorUi> action) {
        CloudAnchorUi current = ui;
        if (current == null) {
            Logger.debug("No UI registered, dropping [{}]", call);
            return;
        }
        try {
            action.accept(current);
        } catch (RuntimeException excp) {
            Logger.warn(excp, "UI call [{}] failed", call);
        }
    }

    public static void setHostAndResolveButtonVisibility(HostResolveVisibility visibility) {
        dispatch("setHostAndResolveButtonVisibility", u -> u.setHostAndResolveButtonVisibility(visibility));
    }

    public static void setRoomCodeText(String text) {
        dispatch("setRoomCodeText", u -> u.setRoomCodeText(text));
    }

    public static void setUi(CloudAnchorUi newUi) {
        ui = newUi;
    }

    public static void showResolveDialog() {
        dispatch("showResolveDialog", CloudAnchorUi::showResolveDialog);
    }
}
