package com.williamcallahan.publist;

import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.williamcallahan.publist.service.PublicationImportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
class PublistApplicationTests {

    @Autowired
    PublicationImportService publicationImportService;

    @Test
    void contextLoads() {
        assertNotNull(publicationImportService);
    }
}
