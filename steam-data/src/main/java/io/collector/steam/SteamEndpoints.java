package io.collector.steam;

/**
 * Base URLs of the two APIs; overridable so runs can go through a mirror or a local stub.
 */
public record SteamEndpoints(String storeAppDetails, String steamSpy) {
    public static final SteamEndpoints DEFAULT = new SteamEndpoints(
            "https://store.steampowered.com/api/appdetails/",
            "https://steamspy.com/api.php");
}
