package com.elphel.stereobp.common;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

public class EProperties extends Properties{
	private static final long serialVersionUID = -425120416815883045L;
	public int getProperty(String key, int value){
		return Integer.parseInt(getProperty(key, ""+value).trim());
	}
	public double getProperty(String key, double value){
		return Double.parseDouble(getProperty(key, ""+value).trim());
	}
	public boolean getProperty(String key, boolean value){
		return Boolean.parseBoolean(getProperty(key, ""+value).trim());
	}

	public static EProperties load(Path path) throws IOException {
		EProperties properties = new EProperties();
		try (InputStream is = Files.newInputStream(path)) {
			properties.load(is);
		}
		return properties;
	}

	/**
	 * Load a classpath resource, resolved relative to cls (absolute with a leading '/').
	 * @throws IOException if the resource does not exist or can not be read
	 */
	public static EProperties load(Class<?> cls, String resource) throws IOException {
		EProperties properties = new EProperties();
		try (InputStream is = cls.getResourceAsStream(resource)) {
			if (is == null) {
				throw new IOException("Resource "+resource+" not found for "+cls.getName());
			}
			properties.load(is);
		}
		return properties;
	}

	public void save(Path path, String comments) throws IOException {
		try (OutputStream os = Files.newOutputStream(path)) {
			store(os, comments);
		}
	}
}
