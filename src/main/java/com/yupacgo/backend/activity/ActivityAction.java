package com.yupacgo.backend.activity;

/**
 * Action tags written to {@code activity_logs.action}.
 */
public final class ActivityAction {

    private ActivityAction() {}

    public static final String USER_SIGNUP = "user_signup";
    public static final String USER_LOGIN = "user_login";
    public static final String USER_LOGOUT = "user_logout";
    public static final String PROFILE_UPDATE = "profile_update";
    public static final String PASSWORD_CHANGE = "password_change";
    public static final String ONBOARDING_COMPLETE = "onboarding_complete";
    public static final String WATCHLIST_ADD = "watchlist_add";
    public static final String WATCHLIST_REMOVE = "watchlist_remove";
    public static final String WATCHLIST_UPDATE = "watchlist_update";
    public static final String PORTFOLIO_BUY = "portfolio_buy";
    public static final String PORTFOLIO_SELL = "portfolio_sell";
    public static final String RECOMMENDATION_GENERATE = "recommendation_generate";
    public static final String RECOMMENDATION_VIEW = "recommendation_view";
    public static final String NOTIFICATION_READ = "notification_read";
    public static final String NOTIFICATION_CREATE = "notification_create";
}
