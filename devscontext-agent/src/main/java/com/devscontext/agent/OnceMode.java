package com.devscontext.agent;

import org.springframework.boot.ApplicationArguments;

public final class OnceMode {

    public static final String OPTION = "once";

    private OnceMode() {}

    public static boolean isActive(ApplicationArguments args) {
        return args != null && args.containsOption(OPTION);
    }
}
