/**
** -----------------------------------------------------------------------------**
** BlurProcessorConfiguration.java
**
** Construction-time settings of the blur processor
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurProcessorConfiguration.java is free software: you can redistribute it and/or modify
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
package com.elphel.imagej.blur;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;

public class BlurProcessorConfiguration {
	public static final String DEFAULTS_RESOURCE="/blur-processor.properties";
	public static final String DEFAULT_PREFIX=   "blur.";
	public static final long   DEFAULT_CACHE_MEMORY_BUDGET=150L*1024*1024;

	public long    cacheMemoryBudgetBytes=DEFAULT_CACHE_MEMORY_BUDGET;
	public int     maxCacheEntries=0;    // 0 - limited by memory only
	public int     workerConcurrency=Runtime.getRuntime().availableProcessors(); // concurrent blur jobs
	public int     engineThreads=    Runtime.getRuntime().availableProcessors(); // threads of a single convolution
	public boolean progressive=false;    // deliver a reduced radius preview before the full result
	public double  progressiveScale=0.5; // preview radius scale
	public int     debugLevel=1;

	public BlurProcessorConfiguration(){
	}

	/** Configuration with defaults overridden by the class path resource, if present */
	public static BlurProcessorConfiguration loadDefaults() throws IOException {
		BlurProcessorConfiguration configuration=new BlurProcessorConfiguration();
		InputStream is=BlurProcessorConfiguration.class.getResourceAsStream(DEFAULTS_RESOURCE);
		if (is==null) return configuration;
		try {
			Properties properties=new Properties();
			properties.load(is);
			configuration.getProperties(DEFAULT_PREFIX, properties);
		} finally {
			is.close();
		}
		return configuration;
	}

	/** Replaces values that do not make sense with defaults */
	public void validate(){
		int nCPUs=Runtime.getRuntime().availableProcessors();
		if (this.cacheMemoryBudgetBytes<=0) this.cacheMemoryBudgetBytes=DEFAULT_CACHE_MEMORY_BUDGET;
		if (this.maxCacheEntries<0)         this.maxCacheEntries=0;
		if (this.workerConcurrency<=0)      this.workerConcurrency=nCPUs;
		if (this.engineThreads<=0)          this.engineThreads=nCPUs;
		if (!(this.progressiveScale>0.0) || (this.progressiveScale>1.0)) this.progressiveScale=0.5;
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"cacheMemoryBudgetBytes", this.cacheMemoryBudgetBytes+"");
		properties.setProperty(prefix+"maxCacheEntries",        this.maxCacheEntries+"");
		properties.setProperty(prefix+"workerConcurrency",      this.workerConcurrency+"");
		properties.setProperty(prefix+"engineThreads",          this.engineThreads+"");
		properties.setProperty(prefix+"progressive",            this.progressive+"");
		properties.setProperty(prefix+"progressiveScale",       this.progressiveScale+"");
		properties.setProperty(prefix+"debugLevel",             this.debugLevel+"");
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"cacheMemoryBudgetBytes")!=null)
			this.cacheMemoryBudgetBytes=Long.parseLong(properties.getProperty(prefix+"cacheMemoryBudgetBytes").trim());
		if (properties.getProperty(prefix+"maxCacheEntries")!=null)
			this.maxCacheEntries=Integer.parseInt(properties.getProperty(prefix+"maxCacheEntries").trim());
		if (properties.getProperty(prefix+"workerConcurrency")!=null)
			this.workerConcurrency=Integer.parseInt(properties.getProperty(prefix+"workerConcurrency").trim());
		if (properties.getProperty(prefix+"engineThreads")!=null)
			this.engineThreads=Integer.parseInt(properties.getProperty(prefix+"engineThreads").trim());
		if (properties.getProperty(prefix+"progressive")!=null)
			this.progressive=Boolean.parseBoolean(properties.getProperty(prefix+"progressive").trim());
		if (properties.getProperty(prefix+"progressiveScale")!=null)
			this.progressiveScale=Double.parseDouble(properties.getProperty(prefix+"progressiveScale").trim());
		if (properties.getProperty(prefix+"debugLevel")!=null)
			this.debugLevel=Integer.parseInt(properties.getProperty(prefix+"debugLevel").trim());
	}

	public void saveToXML(String pathname, String comment) throws ConfigurationException {
		XMLConfiguration hConfig=new XMLConfiguration();
		hConfig.setRootElementName("blurProcessor");
		if (comment!=null) hConfig.addProperty("comment",comment);
		hConfig.addProperty("cacheMemoryBudgetBytes",this.cacheMemoryBudgetBytes);
		hConfig.addProperty("maxCacheEntries",       this.maxCacheEntries);
		hConfig.addProperty("workerConcurrency",     this.workerConcurrency);
		hConfig.addProperty("engineThreads",         this.engineThreads);
		hConfig.addProperty("progressive",           this.progressive);
		hConfig.addProperty("progressiveScale",      this.progressiveScale);
		hConfig.addProperty("debugLevel",            this.debugLevel);
		hConfig.save(pathname);
		if (this.debugLevel>1) System.out.println("Saved blur processor configuration to "+pathname);
	}

	public static BlurProcessorConfiguration loadFromXML(String pathname) throws ConfigurationException {
		XMLConfiguration hConfig=new XMLConfiguration(pathname);
		BlurProcessorConfiguration configuration=new BlurProcessorConfiguration();
		configuration.cacheMemoryBudgetBytes=hConfig.getLong   ("cacheMemoryBudgetBytes",configuration.cacheMemoryBudgetBytes);
		configuration.maxCacheEntries=       hConfig.getInt    ("maxCacheEntries",       configuration.maxCacheEntries);
		configuration.workerConcurrency=     hConfig.getInt    ("workerConcurrency",     configuration.workerConcurrency);
		configuration.engineThreads=         hConfig.getInt    ("engineThreads",         configuration.engineThreads);
		configuration.progressive=           hConfig.getBoolean("progressive",           configuration.progressive);
		configuration.progressiveScale=      hConfig.getDouble ("progressiveScale",      configuration.progressiveScale);
		configuration.debugLevel=            hConfig.getInt    ("debugLevel",            configuration.debugLevel);
		if (configuration.debugLevel>1) System.out.println("Loaded blur processor configuration from "+pathname);
		return configuration;
	}

	@Override
	public String toString(){
		return "cacheMemoryBudgetBytes="+cacheMemoryBudgetBytes+", maxCacheEntries="+maxCacheEntries+
				", workerConcurrency="+workerConcurrency+", engineThreads="+engineThreads+
				", progressive="+progressive+", progressiveScale="+progressiveScale+", debugLevel="+debugLevel;
	}
}
