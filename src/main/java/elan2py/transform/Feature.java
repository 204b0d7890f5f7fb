package elan2py.transform;

import java.util.EnumSet;
import java.util.Set;

/**
 * Optional output features, detected once from the whole source before either pass.
 */
public enum Feature {
	GRAPHICS;

	public static Set<Feature> detect(String source) {
		Set<Feature> features = EnumSet.noneOf(Feature.class);
		if (source.contains("Turtle") || GraphicsPrimitive.mentionedIn(source)) {
			features.add(GRAPHICS);
		}
		return features;
	}
}
