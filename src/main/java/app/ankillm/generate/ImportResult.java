package app.ankillm.generate;

import java.util.List;

public record ImportResult(
        int successes,
        List<String> rejected
) {
    public int failures() {
        return rejected.size();
    }
}
