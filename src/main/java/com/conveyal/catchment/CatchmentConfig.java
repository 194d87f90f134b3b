package com.conveyal.catchment;

import com.conveyal.catchment.analyst.SubNetworkAssembler;
import com.conveyal.catchment.analyst.cluster.CatchmentAreaWorker;
import com.conveyal.catchment.network.InMemoryNetworkDatabase;
import com.conveyal.catchment.network.NetworkStore;

import java.util.Properties;

/** Loads configuration for the catchment area core and exposes it to the Components. */
public class CatchmentConfig extends ConfigBase implements NetworkStore.Config, SubNetworkAssembler.Config,
        InMemoryNetworkDatabase.Config, CatchmentAreaWorker.Config {

    public static final String DEFAULT_CONFIG_FILE = "catchment.properties";

    // INSTANCE FIELDS

    private final String cacheDir;
    private final int    workerThreads;
    private final double carBufferSpeedKph;
    private final double snapRadiusMeters;

    // CONSTRUCTORS

    public CatchmentConfig (Properties props) {
        super(props);
        cacheDir = strProp("cache-dir");
        workerThreads = intProp("worker-threads");
        carBufferSpeedKph = doubleProp("car-buffer-speed-kph");
        snapRadiusMeters = doubleProp("snap-radius-meters");
        if (!keysWithErrors.contains("worker-threads") && workerThreads < 1) {
            invalidProp("worker-threads", workerThreads, "at least 1");
        }
        if (!keysWithErrors.contains("car-buffer-speed-kph") && !(carBufferSpeedKph > 0)) {
            invalidProp("car-buffer-speed-kph", carBufferSpeedKph, "positive");
        }
        if (!keysWithErrors.contains("snap-radius-meters") && !(snapRadiusMeters > 0)) {
            invalidProp("snap-radius-meters", snapRadiusMeters, "positive");
        }
        throwIfErrors();
    }

    public static CatchmentConfig fromFile (String filename) {
        return new CatchmentConfig(propsFromFile(filename));
    }

    public static CatchmentConfig fromDefaultFile () {
        return fromFile(DEFAULT_CONFIG_FILE);
    }

    // INTERFACE IMPLEMENTATIONS

    @Override public String cacheDir ()          { return cacheDir; }
    @Override public int    workerThreads ()     { return workerThreads; }
    @Override public double carBufferSpeedKph () { return carBufferSpeedKph; }
    @Override public double snapRadiusMeters ()  { return snapRadiusMeters; }

}
