package com.example.waterrights;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class WaterRightsApplicationTests {

	/**
	 * Ensures the application context loads without throwing exceptions.
	 */
	@Test
	void contextLoads() {
	}

}
