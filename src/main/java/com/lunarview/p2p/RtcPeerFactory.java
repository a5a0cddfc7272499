package com.lunarview.p2p;

import java.util.List;

@FunctionalInterface
public interface RtcPeerFactory {

    RtcPeer create(List<String> stunUrls, RtcPeer.Observer observer);
}
