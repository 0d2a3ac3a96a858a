package org.metapatch.patch.reporting;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.File;
import java.io.FileOutputStream;

/**
 * One test case per audit entry: warnings become failures, skipped entries are marked skipped, an aborted batch is
 * a single error.
 */
public class JUnitPatchReportWriter {

    public File write(File outputDir, String suiteName, PatchReportModels.PatchReport report, String fileName) {
        try {
            if (!outputDir.exists()) {
                outputDir.mkdirs();
            }

            DocumentBuilderFactory dbFactory = DocumentBuilderFactory.newInstance();
            DocumentBuilder dBuilder = dbFactory.newDocumentBuilder();
            Document doc = dBuilder.newDocument();

            Element testsuite = doc.createElement("testsuite");
            testsuite.setAttribute("name", suiteName);
            doc.appendChild(testsuite);

            int tests = 0;
            int failures = 0;
            int skipped = 0;
            if (report.entries != null) {
                for (PatchReportModels.EntryRow row : report.entries) {
                    Element testcase = addTestCase(doc, testsuite, report.operation, caseName(row));
                    tests++;
                    if ("WARN".equals(row.outcome)) {
                        Element failure = doc.createElement("failure");
                        failure.setAttribute("message", row.message == null ? "warning" : row.message);
                        testcase.appendChild(failure);
                        failures++;
                    } else if ("SKIPPED".equals(row.outcome)) {
                        Element skip = doc.createElement("skipped");
                        if (row.message != null) skip.setAttribute("message", row.message);
                        testcase.appendChild(skip);
                        skipped++;
                    }
                }
            }
            int errors = 0;
            if (report.error != null) {
                Element testcase = addTestCase(doc, testsuite, report.operation, report.document);
                Element error = doc.createElement("error");
                error.setAttribute("message", report.error);
                testcase.appendChild(error);
                tests++;
                errors++;
            }

            testsuite.setAttribute("tests", String.valueOf(tests));
            testsuite.setAttribute("failures", String.valueOf(failures));
            testsuite.setAttribute("errors", String.valueOf(errors));
            testsuite.setAttribute("skipped", String.valueOf(skipped));

            File out = new File(outputDir, fileName);
            try (FileOutputStream fos = new FileOutputStream(out)) {
                TransformerFactory tf = TransformerFactory.newInstance();
                Transformer transformer = tf.newTransformer();
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
                transformer.transform(new DOMSource(doc), new StreamResult(fos));
            }

            return out;
        } catch (Exception e) {
            throw new RuntimeException("Failed to write JUnit patch report", e);
        }
    }

    private static String caseName(PatchReportModels.EntryRow row) {
        StringBuilder sb = new StringBuilder();
        if (row.kind != null) sb.append(row.kind);
        if (row.name != null) sb.append(sb.length() == 0 ? "" : " ").append(row.name);
        if (sb.length() == 0) sb.append(row.message);
        return sb.toString();
    }

    private Element addTestCase(Document doc, Element testsuite, String className, String name) {
        Element testcase = doc.createElement("testcase");
        testcase.setAttribute("classname", className == null ? "patch" : className);
        testcase.setAttribute("name", name);
        testsuite.appendChild(testcase);
        return testcase;
    }
}
