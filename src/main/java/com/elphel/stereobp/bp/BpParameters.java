package com.elphel.stereobp.bp;
/**
 **
 ** BpParameters - parameters of the belief propagation stereo matcher
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BpParameters.java is free software: you can redistribute it and/or modify
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

import java.util.Properties;

public class BpParameters {
	public int        num_labels =      16;    // disparity labels, label l is a shift of l pixels
	public double     lambda =          10.0;  // Potts smoothness weight
	public double     tau =             15.0;  // data cost truncation
	public int        num_iterations =  60;    // fixed number of BP rounds, no early exit
	public boolean    boundary_wrap =   true;  // wrap x-l around the left edge (false - clamp to column 0)
	public int        threads_max =     100;   // maximal number of worker threads

	// collaborators outside of the engine
	public double     sigma =           0.6;   // Gaussian pre-smoothing of both images (<=0 - off)
	public boolean    stretch_output =  false; // write disparity stretched to 0..255 instead of raw labels
	public boolean    show_results =    false; // show disparity and energy plot (ignored when headless)
	public int        debug_level =     0;

	public BpParameters() {
	}

	public BpParameters (
			int     num_labels,
			double  lambda,
			double  tau,
			int     num_iterations) {
		this.num_labels =     num_labels;
		this.lambda =         lambda;
		this.tau =            tau;
		this.num_iterations = num_iterations;
	}

	/**
	 * Verify engine parameters, fail before any computation starts.
	 * @throws InvalidParameterException naming the first offending parameter
	 */
	public void validate() {
		if (num_labels <= 0) {
			throw new InvalidParameterException("num_labels", num_labels, "must be positive");
		}
		if (num_iterations <= 0) {
			throw new InvalidParameterException("num_iterations", num_iterations, "must be positive");
		}
		if (tau < 0) {
			throw new InvalidParameterException("tau", tau, "must not be negative");
		}
		if (lambda < 0) {
			throw new InvalidParameterException("lambda", lambda, "must not be negative");
		}
		if (threads_max <= 0) {
			throw new InvalidParameterException("threads_max", threads_max, "must be positive");
		}
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"num_labels",     this.num_labels+"");
		properties.setProperty(prefix+"lambda",         this.lambda+"");
		properties.setProperty(prefix+"tau",            this.tau+"");
		properties.setProperty(prefix+"num_iterations", this.num_iterations+"");
		properties.setProperty(prefix+"boundary_wrap",  this.boundary_wrap+"");
		properties.setProperty(prefix+"threads_max",    this.threads_max+"");

		properties.setProperty(prefix+"sigma",          this.sigma+"");
		properties.setProperty(prefix+"stretch_output", this.stretch_output+"");
		properties.setProperty(prefix+"show_results",   this.show_results+"");
		properties.setProperty(prefix+"debug_level",    this.debug_level+"");
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"num_labels")!=null)     this.num_labels=Integer.parseInt(properties.getProperty(prefix+"num_labels").trim());
		if (properties.getProperty(prefix+"lambda")!=null)         this.lambda=Double.parseDouble(properties.getProperty(prefix+"lambda"));
		if (properties.getProperty(prefix+"tau")!=null)            this.tau=Double.parseDouble(properties.getProperty(prefix+"tau"));
		if (properties.getProperty(prefix+"num_iterations")!=null) this.num_iterations=Integer.parseInt(properties.getProperty(prefix+"num_iterations").trim());
		if (properties.getProperty(prefix+"boundary_wrap")!=null)  this.boundary_wrap=Boolean.parseBoolean(properties.getProperty(prefix+"boundary_wrap").trim());
		if (properties.getProperty(prefix+"threads_max")!=null)    this.threads_max=Integer.parseInt(properties.getProperty(prefix+"threads_max").trim());

		if (properties.getProperty(prefix+"sigma")!=null)          this.sigma=Double.parseDouble(properties.getProperty(prefix+"sigma"));
		if (properties.getProperty(prefix+"stretch_output")!=null) this.stretch_output=Boolean.parseBoolean(properties.getProperty(prefix+"stretch_output").trim());
		if (properties.getProperty(prefix+"show_results")!=null)   this.show_results=Boolean.parseBoolean(properties.getProperty(prefix+"show_results").trim());
		if (properties.getProperty(prefix+"debug_level")!=null)    this.debug_level=Integer.parseInt(properties.getProperty(prefix+"debug_level").trim());
	}

	@Override
	public BpParameters clone() {
		BpParameters bpp = new BpParameters();
		bpp.num_labels =     this.num_labels;
		bpp.lambda =         this.lambda;
		bpp.tau =            this.tau;
		bpp.num_iterations = this.num_iterations;
		bpp.boundary_wrap =  this.boundary_wrap;
		bpp.threads_max =    this.threads_max;
		bpp.sigma =          this.sigma;
		bpp.stretch_output = this.stretch_output;
		bpp.show_results =   this.show_results;
		bpp.debug_level =    this.debug_level;
		return bpp;
	}

	public boolean equals(BpParameters bpp) {
		return
		(bpp.num_labels ==     this.num_labels) &&
		(bpp.lambda ==         this.lambda) &&
		(bpp.tau ==            this.tau) &&
		(bpp.num_iterations == this.num_iterations) &&
		(bpp.boundary_wrap ==  this.boundary_wrap) &&
		(bpp.threads_max ==    this.threads_max) &&
		(bpp.sigma ==          this.sigma) &&
		(bpp.stretch_output == this.stretch_output) &&
		(bpp.show_results ==   this.show_results) &&
		(bpp.debug_level ==    this.debug_level);
	}

	@Override
	public String toString() {
		return String.format("BpParameters{labels=%d, lambda=%g, tau=%g, iterations=%d, wrap=%b}",
				num_labels, lambda, tau, num_iterations, boundary_wrap);
	}
}
