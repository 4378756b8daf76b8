package com.williamcallahan.gvtakeout.cli;

import com.williamcallahan.gvtakeout.GvTakeoutApplication;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Command-line entry point: imports a takeout directory without starting the web server.
 *
 * <p>Options are ordinary Spring properties, for example
 * {@code --app.takeout.input-dir=Takeout/Voice/Calls --app.takeout.format=sqlite}.</p>
 */
public final class TakeoutProcessor {

    private TakeoutProcessor() {}

    public static void main(String[] args) {
        new SpringApplicationBuilder(GvTakeoutApplication.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .properties("app.import.enabled=true")
                .run(args);
    }
}
