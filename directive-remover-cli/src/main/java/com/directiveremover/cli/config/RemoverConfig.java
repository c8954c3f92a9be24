package com.directiveremover.cli.config;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of remover.json. Every field is optional; command-line flags override it.
 */
public class RemoverConfig {

    @SerializedName("target_symbol")
    private String targetSymbol;

    /** Extra symbols defined while parsing, besides the target and its alias. */
    @SerializedName("defines")
    private List<String> defines;

    @SerializedName("include_generated")
    private Boolean includeGenerated;

    @SerializedName("backup")
    private Boolean backup;

    @SerializedName("parallel")
    private Boolean parallel;

    @SerializedName("fail_on_review")
    private Boolean failOnReview;

    /** Path of the JSON report, relative to the working directory. */
    @SerializedName("report")
    private String report;

    /** Directory names skipped while walking a source tree (default: obj, bin, .git). */
    @SerializedName("excluded_directories")
    private List<String> excludedDirectories;

    public String getTargetSymbol()      { return targetSymbol; }
    public List<String> getDefines()     { return defines != null ? defines : Collections.emptyList(); }
    public Boolean getIncludeGenerated() { return includeGenerated; }
    public Boolean getBackup()           { return backup; }
    public Boolean getParallel()         { return parallel; }
    public Boolean getFailOnReview()     { return failOnReview; }
    public String getReport()            { return report; }
    public List<String> getExcludedDirectories() { return excludedDirectories; }
}
