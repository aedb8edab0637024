package net.cadence.core.process;

/** 최대 limit 글자까지만 보관. 초과분은 버리고 개수만 센다 */
public final class BoundedOutputBuffer {
    private final int limit;
    private final StringBuilder buf = new StringBuilder();
    private long dropped;
    private long version;

    public BoundedOutputBuffer(int limit) {
        this.limit = limit;
    }

    public synchronized void append(char[] chars, int off, int len) {
        int room = limit - buf.length();
        int take = Math.max(0, Math.min(room, len));
        buf.append(chars, off, take);
        dropped += len - take;
        version++;
    }

    public synchronized long version() { return version; }

    public synchronized boolean truncated() { return dropped > 0; }

    public synchronized String snapshot() {
        if (dropped == 0) return buf.toString();
        return buf + "\n[output truncated: " + dropped + " chars dropped]";
    }
}
