package com.conveyal.catchment.kryo;

import com.conveyal.catchment.network.NetworkPartition;
import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import org.objenesis.strategy.SerializingInstantiatorStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.Arrays;

/**
 * This class groups the static methods for saving and loading network partitions to the local disk cache.
 *
 * Each serialization or deserialization operation creates a completely new Kryo instance, so there should be no
 * issues with thread safety, as long as the object being serialized is not being changed simultaneously.
 */
public abstract class KryoPartitionSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(KryoPartitionSerializer.class);

    /**
     * This string should be changed to a new value (pv2, pv3...) each time the partition storage format changes, or
     * when the meaning of the stored values changes even though the format does not. Files written with any other
     * version are not loaded. The version is also part of the cache file names, so old files are simply ignored.
     */
    public static final String PARTITION_FORMAT_VERSION = "pv1";

    public static final byte[] HEADER = "CATCHPART".getBytes();

    /**
     * Factory method ensuring that we configure Kryo exactly the same way when saving and loading partitions.
     * Partitions hold only edges, so there is little to gain from registering classes up front.
     */
    private static Kryo makeKryo () {
        Kryo kryo = new Kryo();
        // Auto-associate classes with default serializers the first time each class is encountered.
        kryo.setRegistrationRequired(false);
        // Edges of one partition share no references, but leave this on so shared geometry arrays stay shared.
        kryo.setReferences(true);
        // Edges are immutable and have no zero-argument constructor. Fall back on the Java serialization approach to
        // instantiating them, which bypasses constructors entirely.
        kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new SerializingInstantiatorStrategy()));
        return kryo;
    }

    /** The name of the cache file for the given coarse cell, including the format version. */
    public static String cacheFileName (int coarseCell) {
        return String.format("partition-%d-%s.kryo", coarseCell, PARTITION_FORMAT_VERSION);
    }

    /**
     * Serialize the supplied partition using Kryo, storing the result in a file. The file is written under a
     * temporary name and moved into place, so concurrent readers never see a partially written file. If writing
     * fails the temporary file is removed.
     */
    public static void write (NetworkPartition partition, File file) throws IOException {
        LOG.debug("Writing partition {} to {}", partition.coarseCell, file);
        File tempFile = new File(file.getParentFile(), file.getName() + ".tmp-" + Thread.currentThread().getId());
        Kryo kryo = makeKryo();
        try (Output output = new Output(new FileOutputStream(tempFile))) {
            output.write(HEADER);
            kryo.writeObject(output, PARTITION_FORMAT_VERSION);
            kryo.writeObject(output, partition);
        } catch (IOException | RuntimeException e) {
            // Kryo reports encoding and output failures with unchecked exceptions.
            tempFile.delete();
            throw new IOException("Could not write partition " + partition.coarseCell + " to " + file, e);
        }
        if (!tempFile.renameTo(file)) {
            tempFile.delete();
            throw new IOException("Could not move partition file into place: " + file);
        }
    }

    /**
     * Read the given file and decode it with Kryo into a new NetworkPartition.
     * @throws IOException if the file cannot be read, or was not written by a compatible version of this class.
     */
    public static NetworkPartition read (File file) throws IOException {
        LOG.debug("Reading partition from {}", file);
        Kryo kryo = makeKryo();
        try (Input input = new Input(new FileInputStream(file))) {
            byte[] header = new byte[HEADER.length];
            int bytesRead = input.read(header, 0, header.length);
            if (bytesRead != header.length || !Arrays.equals(HEADER, header)) {
                throw new IOException("Unrecognized file header. Is this a network partition file? " + file);
            }
            String formatVersion = kryo.readObject(input, String.class);
            if (!PARTITION_FORMAT_VERSION.equals(formatVersion)) {
                throw new IOException(String.format("File format version is %s, this code requires %s",
                        formatVersion, PARTITION_FORMAT_VERSION));
            }
            return kryo.readObject(input, NetworkPartition.class);
        } catch (RuntimeException e) {
            // Kryo reports truncated or corrupt input with unchecked exceptions.
            throw new IOException("Could not decode partition file " + file, e);
        }
    }

}
