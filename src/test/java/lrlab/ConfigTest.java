package lrlab;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@AfterEach
	public void restoreDefaults(){
		System.clearProperty(Config.configFileProperty);
		Config.reset();
	}

	@Test
	public void testDefaults(){
		assertEquals(100, Config.followIterationLimit());
		assertEquals("out", Config.getOutputDir());
		assertEquals("LR", Config.getGraphvizRankDir());
	}

	@Test
	public void testOverride() throws IOException {
		Config.load(new StringReader("# comment\ngraphvizFont = Courier\n\nfollowIterationLimit=7\nunknownKey = 1"), "test");
		assertEquals("Courier", Config.getGraphvizFont());
		assertEquals(7, Config.followIterationLimit());
		assertNull(Config.get("unknownKey"));
	}

	@ParameterizedTest
	@ValueSource(strings = {"followIterationLimit = 0", "followIterationLimit = many"})
	public void testInvalidIterationLimit(String line){
		assertThrows(LrlabException.class, () -> Config.load(new StringReader(line), "test"));
		assertEquals(100, Config.followIterationLimit());
	}

	@Test
	public void testInvalidValueLeavesConfigUnchanged(){
		assertThrows(LrlabException.class, () -> Config.load(
				new StringReader("graphvizFont = Courier\noutputDir = drawings\nfollowIterationLimit = -3"), "test"));
		assertEquals("Helvetica", Config.getGraphvizFont());
		assertEquals("out", Config.getOutputDir());
		assertEquals(100, Config.followIterationLimit());
	}

	@Test
	public void testConfigFileFromProperty(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("lrlab.ini");
		Files.write(file, "graphvizRankDir = TB\n".getBytes(StandardCharsets.UTF_8));
		System.setProperty(Config.configFileProperty, file.toString());
		Config.reset();
		assertEquals("TB", Config.getGraphvizRankDir());
		assertEquals(100, Config.followIterationLimit());
	}

	@Test
	public void testInvalidConfigFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("lrlab.ini");
		Files.write(file, "outputDir = drawings\nfollowIterationLimit = 0\n".getBytes(StandardCharsets.UTF_8));
		System.setProperty(Config.configFileProperty, file.toString());
		Config.reset();
		LrlabException error = assertThrows(LrlabException.class, Config::init);
		assertTrue(error.getMessage().contains("has to be positive"), error.getMessage());
		assertThrows(LrlabException.class, Config::getOutputDir);
	}
}
