package com.williamcallahan.gvtakeout;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(properties = "app.import.enabled=false")
@ActiveProfiles("test")
class GvTakeoutApplicationTests {

    @Test
    void contextLoads() {
    }

}
