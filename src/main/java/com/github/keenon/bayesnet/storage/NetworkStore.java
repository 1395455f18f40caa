package com.github.keenon.bayesnet.storage;

import com.github.keenon.bayesnet.model.BayesianNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;

/**
 * Created by keenon on 3/9/16.
 * <p>
 * Saves networks to disk and loads them back, protobuf-encoded. A file holds a single network.
 */
public class NetworkStore {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(NetworkStore.class);

  private NetworkStore() {
  }

  /**
   * Writes a network to 'filename', replacing anything already there. Missing parent directories are created.
   *
   * @param network  the network to write
   * @param filename the file to write to
   * @throws IOException passed through from the file system
   */
  public static void save(BayesianNetwork network, String filename) throws IOException {
    File f = new File(filename);
    File dir = f.getAbsoluteFile().getParentFile();
    if (dir != null && !dir.exists() && !dir.mkdirs()) {
      throw new IOException("Could not create directory " + dir);
    }
    try (OutputStream os = new BufferedOutputStream(new FileOutputStream(f))) {
      network.writeToStream(os);
    }
    log.info("Saved network with {} vertices to {}", network.numVertices(), filename);
  }

  /**
   * Reads a network written by {@link #save(BayesianNetwork, String)}.
   *
   * @param filename the file to read
   * @return the network
   * @throws IOException passed through from the file system, or if the file holds no network
   */
  public static BayesianNetwork load(String filename) throws IOException {
    BayesianNetwork network;
    try (InputStream is = new BufferedInputStream(new FileInputStream(filename))) {
      network = BayesianNetwork.readFromStream(is);
    }
    if (network == null) {
      throw new IOException("File " + filename + " holds no network");
    }
    log.info("Loaded network with {} vertices from {}", network.numVertices(), filename);
    return network;
  }
}
