/*
 * Copyright (C) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.glencoesoftware.nexus;

import com.glencoesoftware.nexus.model.NexusConstants;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.Set;
import org.slf4j.LoggerFactory;

/**
 * Settings of the navigation engine: which entry classes enumeration skips
 * and below which element count the tree walker inlines leaf values.
 */
public class NexusConfig {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(NexusConfig.class);

    /** Classpath resource read by {@link #load()}. */
    public static final String RESOURCE = "nexus-navigator.properties";

    /** Comma separated classes skipped by enumeration. */
    public static final String SKIP_CLASSES_KEY = "nexus.skip.classes";

    /** Leaves with fewer elements than this have their value reported. */
    public static final String INLINE_THRESHOLD_KEY = "nexus.inline.threshold";

    public static final int DEFAULT_INLINE_THRESHOLD = 8;

    private static final NexusConfig DEFAULTS = builder().build();

    private final Set<String> skipClasses;

    private final int inlineThreshold;

    private NexusConfig(Builder builder) {
        this.skipClasses = ImmutableSet.copyOf(builder.skipClasses);
        this.inlineThreshold = builder.inlineThreshold;
    }

    /**
     * Gets the built in configuration.
     *
     * @return the defaults
     */
    public static NexusConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads {@value #RESOURCE} from the classpath, falling back to the
     * defaults for missing keys or a missing resource.
     *
     * @return the loaded configuration
     */
    public static NexusConfig load() {
        Properties properties = new Properties();
        try (InputStream in = NexusConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", RESOURCE);
                return DEFAULTS;
            }
            properties.load(in);
        } catch (IOException e) {
            log.warn("Failed to read {}, using defaults", RESOURCE, e);
            return DEFAULTS;
        }
        return fromProperties(properties);
    }

    /**
     * Builds a configuration from properties.
     *
     * @param properties source of {@value #SKIP_CLASSES_KEY} and
     *                   {@value #INLINE_THRESHOLD_KEY}
     * @return the configuration
     * @throws IllegalArgumentException if the threshold is not a number
     */
    public static NexusConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String skip = properties.getProperty(SKIP_CLASSES_KEY);
        if (skip != null) {
            builder.skipClasses(ImmutableSet.copyOf(
                Splitter.on(',').trimResults().omitEmptyStrings().split(skip)));
        }
        String threshold = properties.getProperty(INLINE_THRESHOLD_KEY);
        if (threshold != null) {
            try {
                builder.inlineThreshold(Integer.parseInt(threshold.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid " + INLINE_THRESHOLD_KEY + ": " + threshold, e);
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets the entry classes skipped by enumeration.
     *
     * @return an immutable set of class names
     */
    public Set<String> getSkipClasses() {
        return skipClasses;
    }

    public int getInlineThreshold() {
        return inlineThreshold;
    }

    /**
     * Whether enumeration skips entries of a class.
     *
     * @param nxclass entry class
     * @return {@code true} if the class is ignorable
     */
    public boolean isSkipped(String nxclass) {
        return skipClasses.contains(nxclass);
    }

    @Override
    public String toString() {
        return "NexusConfig{" + "skipClasses=" + skipClasses + ", inlineThreshold="
            + inlineThreshold + '}';
    }

    /** Builder for {@link NexusConfig}. */
    public static class Builder {

        private Set<String> skipClasses = NexusConstants.H4SKIP;

        private int inlineThreshold = DEFAULT_INLINE_THRESHOLD;

        private Builder() {
        }

        public Builder skipClasses(Set<String> skipClasses) {
            this.skipClasses = Preconditions.checkNotNull(skipClasses, "skipClasses");
            return this;
        }

        public Builder inlineThreshold(int inlineThreshold) {
            Preconditions.checkArgument(inlineThreshold >= 0,
                "Inline threshold must not be negative: %s", inlineThreshold);
            this.inlineThreshold = inlineThreshold;
            return this;
        }

        public NexusConfig build() {
            return new NexusConfig(this);
        }
    }
}
