package org.metapatch.patch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Configuration properties for the patch tool
 */
@Component
@Validated
@ConfigurationProperties(prefix = "patch")
public class PatchConfig {

    @NotEmpty
    private String batchSeparator = ";;";

    @NotBlank
    @Pattern(regexp = "[a-z]{2}", message = "must be a two-letter language code")
    private String defaultLanguage = "ru";

    // Used only when the document itself shows no indentation
    @NotEmpty
    private String indentUnit = "\t";

    private String encoding;  // Optional, BOM or UTF-8 wins when absent

    @Valid
    @NotNull
    private DcsConfig dcs = new DcsConfig();

    @Valid
    @NotNull
    private FormConfig form = new FormConfig();

    @Valid
    @NotNull
    private ConfigurationConfig configuration = new ConfigurationConfig();

    @Valid
    @NotNull
    private ReportConfig report = new ReportConfig();

    // Nested configuration classes
    public static class DcsConfig {
        @NotBlank
        private String dataSourceName = "ИсточникДанных1";
        @NotBlank
        private String dataSourceType = "Local";
        @NotBlank
        private String defaultDatasetName = "НаборДанных1";
        @NotBlank
        private String defaultVariantName = "Основной";

        // Getters and Setters
        public String getDataSourceName() { return dataSourceName; }
        public void setDataSourceName(String dataSourceName) { this.dataSourceName = dataSourceName; }
        public String getDataSourceType() { return dataSourceType; }
        public void setDataSourceType(String dataSourceType) { this.dataSourceType = dataSourceType; }
        public String getDefaultDatasetName() { return defaultDatasetName; }
        public void setDefaultDatasetName(String defaultDatasetName) { this.defaultDatasetName = defaultDatasetName; }
        public String getDefaultVariantName() { return defaultVariantName; }
        public void setDefaultVariantName(String defaultVariantName) { this.defaultVariantName = defaultVariantName; }
    }

    public static class FormConfig {
        @Min(1)
        private int extensionIdBase = 1000000;

        public int getExtensionIdBase() { return extensionIdBase; }
        public void setExtensionIdBase(int extensionIdBase) { this.extensionIdBase = extensionIdBase; }
    }

    public static class ConfigurationConfig {
        private boolean sortObjectsByName = false;  // Keep same-kind objects alphabetical instead of appending

        public boolean isSortObjectsByName() { return sortObjectsByName; }
        public void setSortObjectsByName(boolean sortObjectsByName) { this.sortObjectsByName = sortObjectsByName; }
    }

    public static class ReportConfig {
        @NotBlank
        private String outputDirectory = "./reports";
        // Reporting outputs for CI integrations
        private boolean generateJunit = false;
        private boolean generateJson = false;
        private String junitSubdirectory = "junit";
        private String jsonSubdirectory = "json";
        private String junitFileName = "TEST-patch-report.xml";
        private String jsonFileName = "patch-report.json";
        private String junitSuiteName = "MetadataPatch";

        // Getters and Setters
        public String getOutputDirectory() { return outputDirectory; }
        public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }
        public boolean isGenerateJunit() { return generateJunit; }
        public void setGenerateJunit(boolean generateJunit) { this.generateJunit = generateJunit; }
        public boolean isGenerateJson() { return generateJson; }
        public void setGenerateJson(boolean generateJson) { this.generateJson = generateJson; }
        public String getJunitSubdirectory() { return junitSubdirectory; }
        public void setJunitSubdirectory(String junitSubdirectory) { this.junitSubdirectory = junitSubdirectory; }
        public String getJsonSubdirectory() { return jsonSubdirectory; }
        public void setJsonSubdirectory(String jsonSubdirectory) { this.jsonSubdirectory = jsonSubdirectory; }
        public String getJunitFileName() { return junitFileName; }
        public void setJunitFileName(String junitFileName) { this.junitFileName = junitFileName; }
        public String getJsonFileName() { return jsonFileName; }
        public void setJsonFileName(String jsonFileName) { this.jsonFileName = jsonFileName; }
        public String getJunitSuiteName() { return junitSuiteName; }
        public void setJunitSuiteName(String junitSuiteName) { this.junitSuiteName = junitSuiteName; }
    }

    // Main getters and setters
    public String getBatchSeparator() { return batchSeparator; }
    public void setBatchSeparator(String batchSeparator) { this.batchSeparator = batchSeparator; }
    public String getDefaultLanguage() { return defaultLanguage; }
    public void setDefaultLanguage(String defaultLanguage) { this.defaultLanguage = defaultLanguage; }
    public String getIndentUnit() { return indentUnit; }
    public void setIndentUnit(String indentUnit) { this.indentUnit = indentUnit; }
    public String getEncoding() { return encoding; }
    public void setEncoding(String encoding) { this.encoding = encoding; }
    public DcsConfig getDcs() { return dcs; }
    public void setDcs(DcsConfig dcs) { this.dcs = dcs; }
    public FormConfig getForm() { return form; }
    public void setForm(FormConfig form) { this.form = form; }
    public ConfigurationConfig getConfiguration() { return configuration; }
    public void setConfiguration(ConfigurationConfig configuration) { this.configuration = configuration; }
    public ReportConfig getReport() { return report; }
    public void setReport(ReportConfig report) { this.report = report; }
}
