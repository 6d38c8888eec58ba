package com.dedicatedcode.lindero;

import com.dedicatedcode.lindero.config.ErrorPolicy;
import com.dedicatedcode.lindero.config.LinderoConfiguration;
import com.dedicatedcode.lindero.controller.SimplificationController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "lindero.simplify.tolerance=0.01",
        "lindero.simplify.error-policy=LENIENT",
        "lindero.properties.id-key=c"
})
class LinderoApplicationTest {

    @Autowired
    private LinderoConfiguration config;

    @Autowired
    private SimplificationController controller;

    @Test
    void testConfigurationBound() {
        assertNotNull(controller);
        assertEquals(0.01, config.getSimplifyConfiguration().getTolerance());
        assertEquals(3, config.getSimplifyConfiguration().getPrecision());
        assertEquals(ErrorPolicy.LENIENT, config.getSimplifyConfiguration().getErrorPolicy());
        assertEquals("c", config.getPropertiesConfiguration().getIdKey());
        assertEquals("MPIO_CNMBR", config.getPropertiesConfiguration().getLabelField());
    }
}
