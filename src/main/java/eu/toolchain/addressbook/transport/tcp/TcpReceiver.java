package eu.toolchain.addressbook.transport.tcp;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;
import eu.toolchain.addressbook.messages.Message;
import eu.toolchain.addressbook.serializers.MessageSerializer;
import eu.toolchain.addressbook.serializers.SerializerUtils;
import eu.toolchain.addressbook.transport.BindException;
import eu.toolchain.addressbook.transport.ReceiveMessage;
import eu.toolchain.addressbook.transport.Receiver;

/**
 * Accepts framed messages on a port and queues them. Every connection is read on a thread of its own, so a silent
 * peer can not hold up the others. The queue is handed over to the registered consumer every notify interval, on a
 * single notifier thread.
 */
@Slf4j
public class TcpReceiver implements Receiver {
    static final long STOP_TIMEOUT = 10000;

    private final InetSocketAddress address;
    private final long notifyInterval;
    private final int readTimeout;

    private final ConcurrentLinkedQueue<Message> queue = new ConcurrentLinkedQueue<>();
    private final Set<Socket> open = Collections.newSetFromMap(new ConcurrentHashMap<Socket, Boolean>());

    private volatile ReceiveMessage consumer;
    private volatile boolean stopped = false;

    private ServerSocket server;
    private Thread acceptor;
    private ExecutorService connections;
    private ScheduledExecutorService notifier;
    private volatile Thread notifierThread;

    TcpReceiver(final InetSocketAddress address, final long notifyInterval, final int readTimeout) {
        this.address = address;
        this.notifyInterval = notifyInterval;
        this.readTimeout = readTimeout;
    }

    void start() throws BindException {
        try {
            server = new ServerSocket();
            server.setReuseAddress(true);
            server.bind(new InetSocketAddress(address.getPort()));
        } catch (final IOException e) {
            closeQuietly();
            throw new BindException("failed to bind TCP listener on port " + address.getPort(), e);
        }

        connections = Executors.newCachedThreadPool(new ThreadFactory() {
            @Override
            public Thread newThread(final Runnable r) {
                final Thread t = new Thread(r, "tcp-connection-" + server.getLocalPort());
                t.setDaemon(true);
                return t;
            }
        });

        acceptor = new Thread(new Runnable() {
            @Override
            public void run() {
                accept();
            }
        }, "tcp-receiver-" + server.getLocalPort());
        acceptor.setDaemon(true);
        acceptor.start();

        notifier = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            @Override
            public Thread newThread(final Runnable r) {
                final Thread t = new Thread(r, "tcp-notifier-" + server.getLocalPort());
                t.setDaemon(true);
                notifierThread = t;
                return t;
            }
        });

        notifier.scheduleWithFixedDelay(new Runnable() {
            @Override
            public void run() {
                notifyConsumer();
            }
        }, notifyInterval, notifyInterval, TimeUnit.MILLISECONDS);
    }

    @Override
    public InetSocketAddress getBindAddress() {
        return new InetSocketAddress(address.getHostString(), server.getLocalPort());
    }

    @Override
    public synchronized void register(final ReceiveMessage consumer) {
        if (this.consumer != null)
            throw new IllegalStateException("a consumer is already registered on " + address);

        this.consumer = consumer;
    }

    @Override
    public void stop() {
        if (stopped)
            return;

        stopped = true;
        closeQuietly();

        if (connections != null)
            connections.shutdownNow();

        // blocked reads do not notice interrupts.
        for (final Socket socket : open)
            closeQuietly(socket);

        if (notifier != null)
            notifier.shutdownNow();

        try {
            if (acceptor != null)
                acceptor.join(readTimeout);

            // a consumer which stops its own receiver can not wait for itself.
            if (notifier != null && Thread.currentThread() != notifierThread
                    && !notifier.awaitTermination(STOP_TIMEOUT, TimeUnit.MILLISECONDS))
                log.warn("{}: notifier did not stop within {} ms", address.getPort(), STOP_TIMEOUT);

            if (connections != null && !connections.awaitTermination(readTimeout, TimeUnit.MILLISECONDS))
                log.warn("{}: connections did not close within {} ms", address.getPort(), readTimeout);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void accept() {
        while (!stopped) {
            final Socket socket;

            try {
                socket = server.accept();
            } catch (final IOException e) {
                if (stopped)
                    break;

                log.warn("{}: failed to accept connection: {}", address.getPort(), e.getMessage());
                continue;
            }

            try {
                connections.execute(new Runnable() {
                    @Override
                    public void run() {
                        handle(socket);
                    }
                });
            } catch (final RejectedExecutionException e) {
                log.debug("{}: stopped, dropping connection from {}", address.getPort(),
                        socket.getRemoteSocketAddress());
                closeQuietly(socket);
            }
        }

        log.debug("{}: stopped receiving", address.getPort());
    }

    private void handle(final Socket socket) {
        open.add(socket);

        try {
            if (stopped)
                return;

            read(socket);
        } catch (final IOException e) {
            if (!stopped)
                log.warn("{}: failed to receive message: {}", address.getPort(), e.getMessage());
        } finally {
            open.remove(socket);
            closeQuietly(socket);
        }
    }

    private void read(final Socket socket) throws IOException {
        socket.setSoTimeout(readTimeout);

        final DataInputStream in = new DataInputStream(socket.getInputStream());
        final int length = in.readInt();

        if (length < 0 || length > SerializerUtils.MAX_SIZE)
            throw new IOException("invalid frame length: " + length);

        final byte[] frame = new byte[length];
        in.readFully(frame);

        final OutputStream out = socket.getOutputStream();
        out.write(TcpTransport.ACK);
        out.flush();

        final Message message;

        try {
            message = SerializerUtils.fromBytes(MessageSerializer.get(), frame);
        } catch (final Exception e) {
            log.warn("{}: dropping malformed message from {}", address.getPort(), socket.getRemoteSocketAddress(), e);
            return;
        }

        queue.add(message);
    }

    private void notifyConsumer() {
        final ReceiveMessage consumer = this.consumer;

        if (consumer == null)
            return;

        final List<Message> messages = new ArrayList<>();

        Message next;

        while ((next = queue.poll()) != null)
            messages.add(next);

        for (final Message message : messages) {
            if (stopped)
                return;

            try {
                consumer.message(message);
            } catch (final Exception e) {
                log.error("{}: consumer threw exception", address.getPort(), e);
            }
        }
    }

    private void closeQuietly(final Socket socket) {
        try {
            socket.close();
        } catch (final IOException e) {
            log.warn("{}: failed to close connection", address.getPort(), e);
        }
    }

    private void closeQuietly() {
        if (server == null)
            return;

        try {
            server.close();
        } catch (final IOException e) {
            log.warn("{}: failed to close listener", address.getPort(), e);
        }
    }
}
