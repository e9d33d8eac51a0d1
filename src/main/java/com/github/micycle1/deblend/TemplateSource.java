package com.github.micycle1.deblend;

import java.util.List;

import com.github.micycle1.deblend.footprint.Footprint;
import com.github.micycle1.deblend.footprint.TemplateImage;

/**
 * External routine producing the initial per-band template images of one peak
 * (for example a symmetric-template deblender). Consumed once per footprint to
 * seed H.
 */
@FunctionalInterface
public interface TemplateSource {

	/**
	 * @return one template per band, in band order
	 */
	List<TemplateImage> templates(Footprint footprint, int peak);
}
