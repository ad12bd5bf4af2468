package ai.pokercoach.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the external TexasSolver binary.
 * <p>
 * Covers where the binary lives, how hard it works (threads, accuracy, iteration cap),
 * the bet-size abstraction, how long it may run, and how many instances may run at
 * once. The nested {@link Schema} pins the binary-version-specific parts of the process
 * contract (flag names, result file, output patterns) so an upgrade of the binary is a
 * configuration change.
 * <p>
 * Usage:
 * {@code java -jar engine.jar --spring.profiles.active=solver-live --solver.binary-path=bin/texas_solver}
 */
@Component
@ConfigurationProperties(prefix = "solver")
public class SolverProperties {
  private String binaryPath = "bin/texas_solver";
  private String resourceDir;
  private int threads = 6;
  private double accuracy = 0.3;
  private int maxIterations = 1000;
  private boolean useIsomorphism = true;
  private double allinThreshold = 0.67;
  private int dumpRounds = 2;
  private int printInterval = 10;
  private Duration timeout = Duration.ofMinutes(5);
  private Duration callerTimeout = Duration.ofMinutes(10);
  private int workerPoolSize = 2;
  private Duration retryBackoff = Duration.ofMillis(500);
  private List<Integer> transientExitCodes = new ArrayList<>(List.of(75, 137));
  private Map<String, List<Integer>> betSizes = defaultBetSizes();
  private String ipRange = "AA,KK,QQ,JJ,TT,99:0.75,88:0.75,77:0.5,66:0.5,AK,AQ,AJs,ATs,A5s,KQ,KJs,QJs,JTs,T9s,98s";
  private String oopRange = "AA,KK,QQ,JJ,TT,99,88,77,66,55,AK,AQ,AJ,AT,A9s,A5s,A4s,KQ,KJ,KTs,QJ,QTs,JTs,T9s,98s,87s,76s";
  private Schema schema = new Schema();

  private static Map<String, List<Integer>> defaultBetSizes() {
    Map<String, List<Integer>> sizes = new LinkedHashMap<>();
    sizes.put("flop", new ArrayList<>(List.of(33, 50, 75)));
    sizes.put("turn", new ArrayList<>(List.of(50, 75, 100)));
    sizes.put("river", new ArrayList<>(List.of(50, 75, 100)));
    return sizes;
  }

  public String getBinaryPath() {
    return binaryPath;
  }

  public void setBinaryPath(String binaryPath) {
    this.binaryPath = binaryPath;
  }

  /**
   * Returns the solver's resource directory, or null to use {@code resources} next to the binary
   * when that exists.
   * @return configured resource directory, may be null
   */
  public String getResourceDir() {
    return resourceDir;
  }

  public void setResourceDir(String resourceDir) {
    this.resourceDir = resourceDir;
  }

  public int getThreads() {
    return threads;
  }

  public void setThreads(int threads) {
    this.threads = threads;
  }

  /**
   * Returns the target exploitability, in percent of the pot, at which the solver stops.
   * @return target accuracy, must be positive
   */
  public double getAccuracy() {
    return accuracy;
  }

  public void setAccuracy(double accuracy) {
    this.accuracy = accuracy;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public boolean isUseIsomorphism() {
    return useIsomorphism;
  }

  public void setUseIsomorphism(boolean useIsomorphism) {
    this.useIsomorphism = useIsomorphism;
  }

  /**
   * Returns the stack fraction above which a bet is converted to all-in.
   * @return threshold in (0, 1]
   */
  public double getAllinThreshold() {
    return allinThreshold;
  }

  public void setAllinThreshold(double allinThreshold) {
    this.allinThreshold = allinThreshold;
  }

  public int getDumpRounds() {
    return dumpRounds;
  }

  public void setDumpRounds(int dumpRounds) {
    this.dumpRounds = dumpRounds;
  }

  public int getPrintInterval() {
    return printInterval;
  }

  public void setPrintInterval(int printInterval) {
    this.printInterval = printInterval;
  }

  /**
   * Returns the hard wall-clock limit for one solver process.
   * @return process timeout
   */
  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  /**
   * Returns how long a single caller waits for a solution before giving up. Giving up
   * does not stop the shared computation.
   * @return caller wait limit
   */
  public Duration getCallerTimeout() {
    return callerTimeout;
  }

  public void setCallerTimeout(Duration callerTimeout) {
    this.callerTimeout = callerTimeout;
  }

  /**
   * Returns the number of solver processes allowed to run at once; further solves queue FIFO.
   * @return worker slot count
   */
  public int getWorkerPoolSize() {
    return workerPoolSize;
  }

  public void setWorkerPoolSize(int workerPoolSize) {
    this.workerPoolSize = workerPoolSize;
  }

  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public void setRetryBackoff(Duration retryBackoff) {
    this.retryBackoff = retryBackoff;
  }

  /**
   * Returns the exit statuses that signal resource exhaustion rather than a deterministic
   * failure (EX_TEMPFAIL, SIGKILL from the OOM killer).
   * @return transient exit codes
   */
  public List<Integer> getTransientExitCodes() {
    return transientExitCodes;
  }

  public void setTransientExitCodes(List<Integer> transientExitCodes) {
    this.transientExitCodes = transientExitCodes;
  }

  /**
   * Returns bet sizes, in percent of the pot, per street name ("flop", "turn", "river").
   * @return street to sizes
   */
  public Map<String, List<Integer>> getBetSizes() {
    return betSizes;
  }

  public void setBetSizes(Map<String, List<Integer>> betSizes) {
    this.betSizes = betSizes;
  }

  public String getIpRange() {
    return ipRange;
  }

  public void setIpRange(String ipRange) {
    this.ipRange = ipRange;
  }

  public String getOopRange() {
    return oopRange;
  }

  public void setOopRange(String oopRange) {
    this.oopRange = oopRange;
  }

  public Schema getSchema() {
    return schema;
  }

  public void setSchema(Schema schema) {
    this.schema = schema;
  }

  /**
   * Binary-version-specific process contract: command-line flags, file names and the
   * shape of the output.
   */
  public static class Schema {
    private String inputFileFlag = "--input_file";
    private String resourceDirFlag = "--resource_dir";
    private String inputFileName = "input.txt";
    private String resultFileName = "output_result.json";
    private String iterationPattern = "Iter:\\s*(\\d+)";
    private String exploitabilityPattern = "(?i)exploitability\\s*[:=]?\\s*(-?[0-9]+(?:\\.[0-9]+)?)";
    private String evsField = "evs";
    private String childrenField = "childrens";
    private double frequencyTolerance = 1e-3;

    public String getInputFileFlag() {
      return inputFileFlag;
    }

    public void setInputFileFlag(String inputFileFlag) {
      this.inputFileFlag = inputFileFlag;
    }

    public String getResourceDirFlag() {
      return resourceDirFlag;
    }

    public void setResourceDirFlag(String resourceDirFlag) {
      this.resourceDirFlag = resourceDirFlag;
    }

    public String getInputFileName() {
      return inputFileName;
    }

    public void setInputFileName(String inputFileName) {
      this.inputFileName = inputFileName;
    }

    /**
     * Returns the file the solver dumps its strategy tree to, relative to its working directory.
     * @return result file name
     */
    public String getResultFileName() {
      return resultFileName;
    }

    public void setResultFileName(String resultFileName) {
      this.resultFileName = resultFileName;
    }

    /**
     * Returns the stdout pattern whose first group is an iteration count; the last match wins.
     * @return iteration regex
     */
    public String getIterationPattern() {
      return iterationPattern;
    }

    public void setIterationPattern(String iterationPattern) {
      this.iterationPattern = iterationPattern;
    }

    /**
     * Returns the stdout pattern whose first group is the exploitability; the last match wins.
     * @return exploitability regex
     */
    public String getExploitabilityPattern() {
      return exploitabilityPattern;
    }

    public void setExploitabilityPattern(String exploitabilityPattern) {
      this.exploitabilityPattern = exploitabilityPattern;
    }

    /**
     * Returns the field of the root strategy node holding per-hand EV arrays.
     * @return EV field name
     */
    public String getEvsField() {
      return evsField;
    }

    public void setEvsField(String evsField) {
      this.evsField = evsField;
    }

    /**
     * Field of an action node that maps each action label to the node it leads to.
     * @return children field name
     */
    public String getChildrenField() {
      return childrenField;
    }

    public void setChildrenField(String childrenField) {
      this.childrenField = childrenField;
    }

    /**
     * Returns how far a hand's raw frequency sum may stray from 1 before the output is
     * rejected; rows within tolerance are renormalized.
     * @return tolerance
     */
    public double getFrequencyTolerance() {
      return frequencyTolerance;
    }

    public void setFrequencyTolerance(double frequencyTolerance) {
      this.frequencyTolerance = frequencyTolerance;
    }
  }
}
