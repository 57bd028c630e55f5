/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.test;

import org.pgsession.core.CopyData;
import org.pgsession.core.CopyLine;
import org.pgsession.core.ExecStatus;
import org.pgsession.core.NoticeListener;
import org.pgsession.core.Notification;
import org.pgsession.core.WireClient;
import org.pgsession.core.WireResult;
import org.pgsession.core.WireStatus;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory {@link WireClient} serving scripted results.
 *
 * <p>Statements are matched by prefix, the longest scripted prefix wins; unmatched statements
 * complete with a command status made of their first word. {@code COPY <table> FROM STDIN} and
 * {@code COPY <table> TO STDOUT} run against in-memory tables, through the chunk primitives on
 * protocol 3 and the line primitives on protocol 2.</p>
 */
public class FakeWireClient implements WireClient {
    private static final Pattern COPY_IN = Pattern.compile("^COPY\\s+(\\w+).*FROM\\s+STDIN.*",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern COPY_OUT = Pattern.compile("^COPY\\s+(\\w+).*TO\\s+STDOUT.*",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final byte[] END_OF_COPY = {'\\', '.', '\n'};

    private final int protocolVersion;
    private WireStatus status = WireStatus.CONNECTION_OK;
    private String errorMessage = "";

    private final List<String> statements = new ArrayList<String>();
    private final Map<String, List<FakeResult>> responses = new LinkedHashMap<String, List<FakeResult>>();
    private final Map<String, String> execFailures = new HashMap<String, String>();
    private final Map<String, String> noticesOn = new HashMap<String, String>();
    private final List<FakeResult> served = new ArrayList<FakeResult>();
    private final Deque<WireResult> pending = new ArrayDeque<WireResult>();
    private final Deque<Integer> flushResults = new ArrayDeque<Integer>();
    private final Deque<Notification> notifications = new ArrayDeque<Notification>();

    private NoticeListener noticeListener;
    private boolean nonBlocking;
    private boolean rejectNonBlocking;
    private String sendQueryFailure;
    private String consumeInputFailure;
    private int busyPolls;
    private boolean closed;

    private final Map<String, ByteArrayOutputStream> tables = new HashMap<String, ByteArrayOutputStream>();
    private String copyTable;
    private boolean copyOut;
    private int copyRows;
    private final Deque<byte[]> copyOutLines = new ArrayDeque<byte[]>();
    private byte[] currentLine;
    private int currentLinePos;
    private boolean terminatorSent;
    private boolean copyOutDone;
    private String putCopyDataFailure;
    private boolean failPutCopyEnd;
    private boolean failGetCopyData;
    private String copyRejectMessage;
    private String copyRejectState;
    private final List<String> copyEndMessages = new ArrayList<String>();

    public FakeWireClient() {
        this(3);
    }

    public FakeWireClient(int protocolVersion) {
        this.protocolVersion = protocolVersion;
    }

    //
    // Scripting
    //

    public FakeWireClient respond(String prefix, FakeResult... results) {
        responses.put(prefix, Arrays.asList(results));
        return this;
    }

    /**
     * Makes the statements starting with {@code prefix} produce no result at all.
     */
    public FakeWireClient failExec(String prefix, String message) {
        execFailures.put(prefix, message);
        return this;
    }

    public FakeWireClient noticeOn(String prefix, String notice) {
        noticesOn.put(prefix, notice);
        return this;
    }

    public void failSendQuery(String message) {
        this.sendQueryFailure = message;
    }

    public void failConsumeInput(String message) {
        this.consumeInputFailure = message;
    }

    public void setBusyPolls(int busyPolls) {
        this.busyPolls = busyPolls;
    }

    public void queueFlushResults(Integer... results) {
        flushResults.addAll(Arrays.asList(results));
    }

    public void setStatus(WireStatus status) {
        this.status = status;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public void rejectNonBlocking() {
        this.rejectNonBlocking = true;
    }

    public void addNotification(Notification notification) {
        notifications.add(notification);
    }

    public void sendNotice(String notice) {
        noticeListener.noticeReceived(notice);
    }

    public void setTable(String table, String content) {
        setTable(table, content.getBytes(StandardCharsets.UTF_8));
    }

    public void setTable(String table, byte[] content) {
        ByteArrayOutputStream data = new ByteArrayOutputStream();
        data.write(content, 0, content.length);
        tables.put(table, data);
    }

    public String getTable(String table) {
        byte[] data = getTableBytes(table);
        return data == null ? null : new String(data, StandardCharsets.UTF_8);
    }

    public byte[] getTableBytes(String table) {
        ByteArrayOutputStream data = tables.get(table);
        return data == null ? null : data.toByteArray();
    }

    public void failPutCopyData(String message) {
        this.putCopyDataFailure = message;
    }

    public void failPutCopyEnd(String message) {
        this.failPutCopyEnd = true;
        this.errorMessage = message;
    }

    public void failGetCopyData(String message) {
        this.failGetCopyData = true;
        this.errorMessage = message;
    }

    /**
     * Makes the backend reject the data of the next COPY FROM STDIN.
     */
    public void rejectCopy(String message, String sqlState) {
        this.copyRejectMessage = message;
        this.copyRejectState = sqlState;
    }

    //
    // Inspection
    //

    public List<String> getStatements() {
        return new ArrayList<String>(statements);
    }

    public int count(String statement) {
        int n = 0;
        for (String s : statements) {
            if (s.equals(statement)) {
                n++;
            }
        }
        return n;
    }

    public List<FakeResult> getServed() {
        return served;
    }

    public List<String> getCopyEndMessages() {
        return copyEndMessages;
    }

    public boolean isClosed() {
        return closed;
    }

    public int getPendingCount() {
        return pending.size();
    }

    //
    // WireClient
    //

    @Override
    public WireStatus getStatus() {
        return status;
    }

    @Override
    public int getProtocolVersion() {
        return protocolVersion;
    }

    @Override
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public WireResult exec(String query) {
        statements.add(query);
        String failure = lookup(execFailures, query);
        if (failure != null) {
            errorMessage = failure;
            return null;
        }
        List<FakeResult> results = resultsFor(query);
        for (int i = 0; i < results.size() - 1; i++) {
            results.get(i).clear();
        }
        return results.isEmpty() ? null : results.get(results.size() - 1);
    }

    @Override
    public boolean sendQuery(String query) {
        statements.add(query);
        if (sendQueryFailure != null) {
            errorMessage = sendQueryFailure;
            return false;
        }
        pending.addAll(resultsFor(query));
        return true;
    }

    private List<FakeResult> resultsFor(String query) {
        String notice = lookup(noticesOn, query);
        if (notice != null && noticeListener != null) {
            noticeListener.noticeReceived(notice);
        }

        List<FakeResult> results = new ArrayList<FakeResult>();
        Matcher in = COPY_IN.matcher(query);
        Matcher out = COPY_OUT.matcher(query);
        if (in.matches()) {
            startCopy(in.group(1), false);
            results.add(new FakeResult(ExecStatus.COPY_IN));
        } else if (out.matches()) {
            startCopy(out.group(1), true);
            byte[] content = tables.get(copyTable).toByteArray();
            int start = 0;
            while (start < content.length) {
                int end = start;
                while (end < content.length && content[end] != '\n') {
                    end++;
                }
                copyRows++;
                if (end == content.length) {
                    copyOutLines.add(Arrays.copyOfRange(content, start, end));
                } else {
                    // the legacy protocol strips the newline, the chunked one keeps it
                    copyOutLines.add(Arrays.copyOfRange(content, start, protocolVersion >= 3 ? end + 1 : end));
                }
                start = end + 1;
            }
            results.add(new FakeResult(ExecStatus.COPY_OUT));
        } else {
            List<FakeResult> scripted = lookup(responses, query);
            if (scripted == null) {
                String word = query.trim().split("[\\s;]+")[0].toUpperCase();
                results.add(FakeResult.command(word, ""));
            } else {
                for (FakeResult result : scripted) {
                    results.add(result.copy());
                }
            }
        }
        served.addAll(results);
        return results;
    }

    private static <T> T lookup(Map<String, T> map, String query) {
        String best = null;
        for (String prefix : map.keySet()) {
            if (query.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best == null ? null : map.get(best);
    }

    private void startCopy(String table, boolean out) {
        copyTable = table;
        copyOut = out;
        copyRows = 0;
        copyOutLines.clear();
        currentLine = null;
        terminatorSent = false;
        copyOutDone = false;
        if (!tables.containsKey(table)) {
            tables.put(table, new ByteArrayOutputStream());
        }
    }

    @Override
    public boolean consumeInput() {
        if (consumeInputFailure != null) {
            errorMessage = consumeInputFailure;
            return false;
        }
        return true;
    }

    @Override
    public boolean isBusy() {
        if (busyPolls > 0) {
            busyPolls--;
            return true;
        }
        return false;
    }

    @Override
    public int flush() {
        Integer result = flushResults.poll();
        return result == null ? 0 : result;
    }

    @Override
    public WireResult getResult() {
        return pending.poll();
    }

    @Override
    public boolean setNonBlocking(boolean nonBlocking) {
        if (rejectNonBlocking) {
            return false;
        }
        this.nonBlocking = nonBlocking;
        return true;
    }

    @Override
    public boolean isNonBlocking() {
        return nonBlocking;
    }

    @Override
    public int putCopyData(byte[] buffer, int length) {
        if (putCopyDataFailure != null) {
            errorMessage = putCopyDataFailure;
            return -1;
        }
        tables.get(copyTable).write(buffer, 0, length);
        for (int i = 0; i < length; i++) {
            if (buffer[i] == '\n') {
                copyRows++;
            }
        }
        return 1;
    }

    @Override
    public int putCopyEnd(String message) {
        copyEndMessages.add(message);
        if (failPutCopyEnd) {
            status = WireStatus.CONNECTION_BAD;
            return -1;
        }
        if (message != null) {
            pending.add(FakeResult.error("ERROR:  COPY from stdin failed: " + message, "57014"));
        } else {
            finishCopyIn();
        }
        copyTable = null;
        return 1;
    }

    private void finishCopyIn() {
        if (copyRejectMessage != null) {
            if (protocolVersion >= 3) {
                pending.add(FakeResult.error(copyRejectMessage, copyRejectState));
            } else {
                noticeListener.noticeReceived(copyRejectMessage);
                pending.add(FakeResult.command("COPY", ""));
            }
            copyRejectMessage = null;
            return;
        }
        pending.add(FakeResult.command("COPY " + copyRows, String.valueOf(copyRows)));
    }

    @Override
    public CopyData getCopyData(boolean async) {
        if (failGetCopyData) {
            return CopyData.error();
        }
        byte[] line = copyOutLines.poll();
        if (line != null) {
            return CopyData.of(line);
        }
        if (!copyOutDone) {
            copyOutDone = true;
            pending.add(FakeResult.command("COPY " + copyRows, String.valueOf(copyRows)));
        }
        return CopyData.done();
    }

    @Override
    public int putLine(byte[] line) {
        if (Arrays.equals(END_OF_COPY, line)) {
            terminatorSent = true;
            return 0;
        }
        tables.get(copyTable).write(line, 0, line.length);
        copyRows++;
        return 0;
    }

    @Override
    public CopyLine getLine(int bufferSize) {
        if (currentLine == null) {
            currentLine = copyOutLines.poll();
            currentLinePos = 0;
            if (currentLine == null) {
                if (terminatorSent) {
                    return CopyLine.endOfData();
                }
                terminatorSent = true;
                currentLine = "\\.".getBytes(StandardCharsets.UTF_8);
            }
        }
        int room = bufferSize - 1;
        int remaining = currentLine.length - currentLinePos;
        if (remaining > room) {
            byte[] chunk = Arrays.copyOfRange(currentLine, currentLinePos, currentLinePos + room);
            currentLinePos += room;
            return new CopyLine(CopyLine.LINE_CONTINUES, chunk);
        }
        byte[] chunk = Arrays.copyOfRange(currentLine, currentLinePos, currentLine.length);
        currentLine = null;
        return new CopyLine(CopyLine.LINE_COMPLETE, chunk);
    }

    @Override
    public int endCopy() {
        if (copyTable == null) {
            return 0;
        }
        if (copyOut) {
            pending.add(FakeResult.command("COPY " + copyRows, String.valueOf(copyRows)));
        } else {
            finishCopyIn();
        }
        copyTable = null;
        return 0;
    }

    @Override
    public void setNoticeListener(NoticeListener listener) {
        this.noticeListener = listener;
    }

    @Override
    public Notification getNotification() {
        return notifications.poll();
    }

    @Override
    public void close() {
        closed = true;
    }
}
