package com.elphel.stereobp;
/**
 **
 ** StereoBp - command line stereo matcher: read, smooth, match, save
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  StereoBp.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.stereobp.bp.BpEngine;
import com.elphel.stereobp.bp.BpParameters;
import com.elphel.stereobp.bp.BpResult;
import com.elphel.stereobp.bp.StereoImage;
import com.elphel.stereobp.common.EProperties;
import com.elphel.stereobp.export.DisparityWriter;
import com.elphel.stereobp.export.EnergyTraceWriter;
import com.elphel.stereobp.export.ResultDisplay;
import com.elphel.stereobp.readers.GaussianSmoothing;
import com.elphel.stereobp.readers.StereoPairReader;

public class StereoBp {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(StereoBp.class);
	public static final String PROPERTIES_PREFIX = "STEREO_BP.";
	/** Classpath defaults, applied before the optional parameters file */
	public static final String DEFAULTS_RESOURCE = "/stereo_bp.properties";
	public static final String USAGE =
			"Usage: StereoBp <left image> <right image> [parameters.properties] [output directory]";

	/**
	 * Full pipeline for one stereo pair.
	 * @param left_path reference (left) image
	 * @param right_path matched (right) image
	 * @param out_dir directory for disparity_&lt;lambda&gt;.png and energy_&lt;lambda&gt;.csv
	 * @param bpParameters matcher and collaborator parameters
	 * @return matcher result
	 */
	public static BpResult process(
			Path         left_path,
			Path         right_path,
			Path         out_dir,
			BpParameters bpParameters) throws IOException
	{
		StereoImage [] pair = StereoPairReader.readPair(left_path, right_path);
		pair = GaussianSmoothing.smoothPair(pair, bpParameters.sigma);
		BpResult result = new BpEngine(pair[0], pair[1], bpParameters).run();
		Files.createDirectories(out_dir);
		DisparityWriter.write(
				result,
				out_dir.resolve(DisparityWriter.defaultFileName(bpParameters.lambda)),
				bpParameters.stretch_output);
		EnergyTraceWriter.write(
				result.getEnergy(),
				out_dir.resolve(EnergyTraceWriter.defaultFileName(bpParameters.lambda)));
		if (bpParameters.show_results) {
			ResultDisplay.show(result, left_path.getFileName().toString());
		}
		return result;
	}

	/**
	 * Parameters from {@link #DEFAULTS_RESOURCE} overridden by an optional properties file,
	 * keys prefixed with {@link #PROPERTIES_PREFIX}.
	 */
	public static BpParameters readParameters(Path properties_path) throws IOException {
		return readParameters(DEFAULTS_RESOURCE, properties_path);
	}

	/**
	 * @param defaults_resource classpath resource with default parameters
	 * @param properties_path parameters file overriding the defaults, may be null
	 */
	public static BpParameters readParameters(
			String defaults_resource,
			Path   properties_path) throws IOException
	{
		BpParameters bpParameters = new BpParameters();
		bpParameters.getProperties(PROPERTIES_PREFIX, EProperties.load(StereoBp.class, defaults_resource));
		LOGGER.debug("Default parameters from {}: {}", defaults_resource, bpParameters);
		if (properties_path != null) {
			EProperties properties = EProperties.load(properties_path);
			bpParameters.getProperties(PROPERTIES_PREFIX, properties);
			LOGGER.info("Read parameters from "+properties_path+": "+bpParameters);
		}
		return bpParameters;
	}

	/**
	 * @return process exit code, 0 - success
	 */
	public static int run(String [] args) {
		if ((args.length < 2) || (args.length > 4)) {
			LOGGER.error(USAGE);
			return 2;
		}
		Path left_path =  Paths.get(args[0]);
		Path right_path = Paths.get(args[1]);
		Path properties_path = (args.length > 2) ? Paths.get(args[2]) : null;
		Path out_dir = (args.length > 3) ? Paths.get(args[3]) : Paths.get(".");
		try {
			BpParameters bpParameters = readParameters(properties_path);
			process(left_path, right_path, out_dir, bpParameters);
		} catch (IOException e) {
			LOGGER.error("Stereo BP failed: "+e.getMessage());
			return 1;
		} catch (IllegalArgumentException e) { // shape mismatch, invalid parameters
			LOGGER.error("Stereo BP rejected input: "+e.getMessage());
			return 1;
		}
		return 0;
	}

	public static void main(String [] args) {
		int status = run(args);
		if (status != 0) {
			System.exit(status);
		}
	}
}
