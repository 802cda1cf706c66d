package io.collector.steam;

import io.collector.core.Schema;

final class SteamColumns {
    private SteamColumns() {}

    static final Schema STEAM_STORE = Schema.of(
            "type", "name", "steam_appid", "required_age", "is_free", "controller_support",
            "dlc", "detailed_description", "about_the_game", "short_description", "fullgame",
            "supported_languages", "header_image", "website", "pc_requirements", "mac_requirements",
            "linux_requirements", "legal_notice", "drm_notice", "ext_user_account_notice",
            "developers", "publishers", "demos", "price_overview", "packages", "package_groups",
            "platforms", "metacritic", "reviews", "categories", "genres", "screenshots",
            "movies", "recommendations", "achievements", "release_date", "support_info",
            "background", "content_descriptors");

    static final Schema STEAMSPY = Schema.of(
            "appid", "name", "developer", "publisher", "score_rank", "positive",
            "negative", "userscore", "owners", "average_forever", "average_2weeks",
            "median_forever", "median_2weeks", "price", "initialprice", "discount",
            "languages", "genre", "ccu", "tags");
}
