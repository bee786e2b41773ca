package com.docformat.cli.pipeline;

import com.docformat.core.location.Location;
import com.docformat.core.location.LocationService;
import com.docformat.core.model.DocumentationNode;
import com.docformat.core.model.NodeKind;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lays pages out as one folder per node that has members.
 *
 * <p>A node with members gets {@code <ancestors>/<name>/index.<ext>}; a leaf node gets
 * {@code <ancestors>/<name>.<ext>}. The module root is not part of any path, so the root
 * page is {@code index.<ext>}. Overloads share a name and therefore a page.
 *
 * <p><b>Example:</b>
 * <pre>
 * module                      index.html
 * com.example                 com.example/index.html
 * com.example.Parser          com.example/Parser/index.html
 * com.example.Parser.parse    com.example/Parser/parse.html
 * </pre>
 *
 * <p>A leaf named {@code index} is written to {@code index_.<ext>} so it does not
 * replace its owner's page. Names made only of dots never become path segments.
 *
 * <p>Relative locations always use {@code /} as separator.
 */
public class FolderLocationService implements LocationService {

    private static final String INDEX = "index";
    private static final String RESERVED_INDEX = "index_";

    @Override
    public Location location(DocumentationNode node, String extension) {
        List<String> segments = node.path().stream()
            .filter(ancestor -> ancestor.kind() != NodeKind.MODULE)
            .map(ancestor -> toFileName(ancestor.name()))
            .collect(Collectors.toList());

        String fileName;
        if (segments.isEmpty() || !node.members().isEmpty()) {
            fileName = INDEX + "." + extension;
        } else {
            String leaf = segments.remove(segments.size() - 1);
            fileName = (leaf.equals(INDEX) ? RESERVED_INDEX : leaf) + "." + extension;
        }
        segments.add(fileName);
        return new Location(String.join("/", segments));
    }

    @Override
    public Location relativeLocation(Location from, DocumentationNode to, String extension) {
        Path target = Paths.get(location(to, extension).path());
        Path fromDirectory = Paths.get(from.path()).getParent();
        Path relative = fromDirectory == null ? target : fromDirectory.relativize(target);
        return new Location(relative.toString().replace('\\', '/'));
    }

    /**
     * Maps a node name to a portable file name.
     *
     * @param name node name
     * @return name with every character outside {@code [A-Za-z0-9._-]} replaced by {@code _},
     *         and dots replaced too when the name consists of dots only
     */
    static String toFileName(String name) {
        if (name.isEmpty()) {
            return "_";
        }
        String fileName = name.replaceAll("[^A-Za-z0-9._-]", "_");
        if (fileName.chars().allMatch(c -> c == '.')) {
            return fileName.replace('.', '_');
        }
        return fileName;
    }
}
