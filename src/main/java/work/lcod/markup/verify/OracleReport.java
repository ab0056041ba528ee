package work.lcod.markup.verify;

import java.util.LinkedHashMap;
import java.util.Map;

public record OracleReport(boolean matches, int refTagCount, int ourTagCount, String details) {
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("matches", matches);
        map.put("ref_tag_count", refTagCount);
        map.put("our_tag_count", ourTagCount);
        map.put("details", details);
        return map;
    }
}
