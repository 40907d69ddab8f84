import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.yongkangl.newick.io.NewickParser;
import com.yongkangl.newick.io.TreeJsonWriter;
import com.yongkangl.newick.tree.BranchLengthSummary;
import com.yongkangl.newick.tree.Node;
import com.yongkangl.newick.tree.Tree;
import org.apache.commons.cli.*;

public class NewickSummary {
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Options options = new Options();
        options.addOption("f", "file", true, "Newick file, one tree per line");
        options.addOption("l", "line", true, "Only summarise this line (1-based)");
        options.addOption("t", "traversal", true, "Also list labels in traversal order: bf or df");
        options.addOption("j", "json", false, "Print trees as JSON instead of Newick");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;

        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            System.err.println("Error parsing command line: " + e.getMessage());
            return 1;
        }

        String filePath = "trees.nwk";
        int line = 0;
        String traversal = null;
        boolean json = cmd.hasOption("json");

        if (cmd.hasOption("file")) {
            filePath = cmd.getOptionValue("file");
        }
        if (cmd.hasOption("line")) {
            try {
                line = Integer.parseInt(cmd.getOptionValue("line"));
            } catch (NumberFormatException e) {
                System.err.println("Invalid number for line");
                return 1;
            }
        }
        if (cmd.hasOption("traversal")) {
            traversal = cmd.getOptionValue("traversal");
            if (!traversal.equals("bf") && !traversal.equals("df")) {
                System.err.println("Traversal must be bf or df");
                return 1;
            }
        }

        TreeJsonWriter jsonWriter = new TreeJsonWriter();
        int failures = 0;
        try (BufferedReader reader = new BufferedReader(new FileReader(filePath))) {
            String inputLine;
            int lineNumber = 0;
            while ((inputLine = reader.readLine()) != null) {
                lineNumber++;
                if ((line > 0 && lineNumber != line) || inputLine.isBlank()) {
                    continue;
                }
                Tree tree;
                try {
                    tree = NewickParser.parse(inputLine);
                } catch (IllegalArgumentException e) {
                    // NumberFormatException and MalformedTreeException both land here
                    System.err.println("Line " + lineNumber + ": " + e.getMessage());
                    failures++;
                    continue;
                }
                System.out.println(describe(lineNumber, tree));
                if (traversal != null && !tree.isEmpty()) {
                    Iterable<Node> order = traversal.equals("bf")
                            ? tree.getRoot().breadthFirst()
                            : tree.getRoot().depthFirst();
                    System.out.println("  " + traversal + ": " + String.join(" ", labels(order)));
                }
                System.out.println(json ? jsonWriter.write(tree, true) : tree.toNewick());
            }
        } catch (JsonProcessingException e) {
            System.err.println("Error writing JSON: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Error reading file: " + e.getMessage());
            return 1;
        }
        return failures > 0 ? 1 : 0;
    }

    static String describe(int lineNumber, Tree tree) {
        return "Line " + lineNumber + ": nodes=" + tree.size()
                + " leaves=" + tree.leaves().size()
                + " " + BranchLengthSummary.of(tree);
    }

    private static List<String> labels(Iterable<Node> nodes) {
        List<String> labels = new ArrayList<>();
        for (Node node : nodes) {
            labels.add(node.getLabel().isEmpty() ? "-" : node.getLabel());
        }
        return labels;
    }
}
