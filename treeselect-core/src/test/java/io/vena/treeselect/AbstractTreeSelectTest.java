package io.vena.treeselect;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.slf4j.LoggerFactory;

import static java.util.stream.Collectors.toList;

/**
 * Gives each test its own {@link TreeSelectContext}, so latches and
 * counters don't leak between tests, plus the trees most tests use.
 */
public abstract class AbstractTreeSelectTest {
	protected TreeSelectContext context;
	protected TreeSelect treeSelect;
	private final Deque<Runnable> tearDownActions = new ArrayDeque<>();

	@BeforeEach
	void setUpTreeSelect() {
		context = new TreeSelectContext();
		treeSelect = new TreeSelect(context);
	}

	@AfterEach
	void runTearDown() {
		tearDownActions.forEach(Runnable::run);
		tearDownActions.clear();
	}

	/**
	 * <pre>
	 * A
	 * +-- B
	 * |   +-- D
	 * |   +-- E
	 * +-- C
	 * </pre>
	 */
	public static List<RawNode> sampleTree() {
		return List.of(
			node("A",
				node("B",
					node("D"),
					node("E")),
				node("C")));
	}

	/**
	 * Two top-level nodes, the second with a three-level subtree.
	 *
	 * <pre>
	 * P
	 * +-- P1
	 * +-- P2
	 * Q
	 * +-- Q1
	 * |   +-- Q11
	 * |   |   +-- Q111
	 * |   |   +-- Q112
	 * |   +-- Q12
	 * +-- Q2
	 * </pre>
	 */
	public static List<RawNode> forest() {
		return List.of(
			node("P",
				node("P1"),
				node("P2")),
			node("Q",
				node("Q1",
					node("Q11",
						node("Q111"),
						node("Q112")),
					node("Q12")),
				node("Q2")));
	}

	/**
	 * A node whose value, and therefore key, is <code>value</code>,
	 * titled <code>"Node " + value</code>.
	 */
	public static RawNode node(String value, RawNode... children) {
		return RawNode.builder()
			.value(value)
			.title("Node " + value)
			.children(List.of(children))
			.build();
	}

	protected ListAppender<ILoggingEvent> captureLogging(Class<?> loggerClass) {
		Logger logger = (Logger) LoggerFactory.getLogger(loggerClass);
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		logger.addAppender(appender);
		tearDownActions.addFirst(() -> {
			logger.detachAppender(appender);
			appender.stop();
		});
		return appender;
	}

	protected static List<String> warnings(ListAppender<ILoggingEvent> appender) {
		return appender.list.stream()
			.filter(e -> e.getLevel() == Level.WARN)
			.map(ILoggingEvent::getFormattedMessage)
			.collect(toList());
	}
}
