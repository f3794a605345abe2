package org.pncover.utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class StringFileIO {

	public static String readFileAsString(String filePath) throws IOException {
		return new String(Files.readAllBytes(Paths.get(filePath)), StandardCharsets.UTF_8);
	}

	/**
	 * Reads a classpath resource, returning null when it does not exist.
	 */
	public static String readResourceAsString(String resourceName) throws IOException {
		ClassLoader loader = Thread.currentThread().getContextClassLoader();
		if (loader == null) {
			loader = StringFileIO.class.getClassLoader();
		}
		try (InputStream in = loader.getResourceAsStream(resourceName)) {
			if (in == null) {
				return null;
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	public static void writeStringToFile(String iString, String filePath) throws IOException {
		Path target = Paths.get(filePath);
		Path parent = target.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.write(target, iString.getBytes(StandardCharsets.UTF_8));
	}

}
